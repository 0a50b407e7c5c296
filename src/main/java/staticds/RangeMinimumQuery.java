package staticds;

/**
 * Range-minimum query over a static integer array.
 */
public interface RangeMinimumQuery {

    /**
     * Return the position of a minimum of the array in the inclusive range between
     * {@code left} and {@code right}. The bounds may be given in either order.
     *
     * @throws IndexOutOfBoundsException if a bound lies outside the array
     */
    int rmq(int left, int right);

    // Length of the array the structure was built over.
    int size();
}
