package datagenerators;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class GeneratorTest {

    @Test
    public void test_uniform_is_reproducible_and_stays_in_pool() {
        String a = Generator.generateUniform(500, Generator.DNA, 3L);
        String b = Generator.generateUniform(500, Generator.DNA, 3L);
        assertEquals(a, b);
        assertEquals(500, a.length());
        assertTrue(a.chars().allMatch(c -> "acgt".indexOf(c) >= 0));
        assertNotEquals(a, Generator.generateUniform(500, Generator.DNA, 4L));
    }

    @Test
    public void test_zipf_favours_the_first_symbol() {
        String text = Generator.generateZipf(5000, Generator.DNA, 2.0, 11L);
        long first = text.chars().filter(c -> c == 'a').count();
        long last = text.chars().filter(c -> c == 't').count();
        assertTrue(first > last);
        assertEquals(text, Generator.generateZipf(5000, Generator.DNA, 2.0, 11L));
    }

    @Test
    public void test_printable_pool() {
        assertEquals(95, Generator.PRINTABLE.length);
        assertEquals(' ', Generator.PRINTABLE[0]);
        assertEquals('~', Generator.PRINTABLE[94]);
        assertEquals("", Generator.generateUniform(0, Generator.PRINTABLE, 1L));
    }

    @Test(expected = IllegalArgumentException.class)
    public void test_empty_pool_is_rejected() {
        Generator.generateUniform(10, new char[0], 1L);
    }
}
