package gov.nih.ncats.dugr.util;

import static org.junit.Assert.*;

import java.util.concurrent.atomic.AtomicInteger;

import org.junit.Test;

public class CachedSupplierTest {

    @Test
    public void delegateIsCalledOnce(){
        AtomicInteger calls = new AtomicInteger();
        CachedSupplier<Integer> s = CachedSupplier.of(calls::incrementAndGet);
        assertEquals(0, calls.get());
        assertEquals(1, s.get().intValue());
        assertEquals(1, s.get().intValue());
        assertEquals(1, calls.get());
    }
}
