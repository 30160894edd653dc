package gov.nih.ncats.molgraph.internal.util;

import static org.junit.Assert.*;

import java.util.concurrent.atomic.AtomicInteger;

import org.junit.Test;

public class CachedSupplierTest {

	@Test
	public void computesOnlyOnce(){
		AtomicInteger calls = new AtomicInteger();
		CachedSupplier<Integer> sut = CachedSupplier.of(calls::incrementAndGet);
		assertFalse(sut.hasRun());
		assertEquals(Integer.valueOf(1), sut.get());
		assertEquals(Integer.valueOf(1), sut.get());
		assertTrue(sut.hasRun());
		assertEquals(1, calls.get());
	}

	@Test
	public void resetRecomputes(){
		AtomicInteger calls = new AtomicInteger();
		CachedSupplier<Integer> sut = CachedSupplier.of(calls::incrementAndGet);
		sut.get();
		sut.resetCache();
		assertFalse(sut.hasRun());
		assertEquals(Integer.valueOf(2), sut.get());
	}

	@Test
	public void nullResultIsCached(){
		AtomicInteger calls = new AtomicInteger();
		CachedSupplier<String> sut = CachedSupplier.of(()->{
			calls.incrementAndGet();
			return null;
		});
		assertNull(sut.get());
		assertNull(sut.get());
		assertEquals(1, calls.get());
	}
}
