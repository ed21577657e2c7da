package io.fairsched.admission;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class EwmaTest {
    @Test
    void first_sample_seeds_then_smooths() {
        Ewma e = new Ewma(0.5);
        assertFalse(e.hasValue());
        e.update(100);
        assertEquals(100, e.get(), 1e-9);
        e.update(200);
        assertEquals(150, e.get(), 1e-9);
    }

    @Test
    void clamps_alpha_into_open_interval() {
        assertEquals(0.999, new Ewma(5).alpha(), 1e-12);
        assertEquals(0.001, new Ewma(0).alpha(), 1e-12);
    }
}
