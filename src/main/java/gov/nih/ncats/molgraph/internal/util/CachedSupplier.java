package gov.nih.ncats.molgraph.internal.util;


import java.util.function.Supplier;

/**
 * Memoized supplier. Caches the result of the supplier
 * until {@link #resetCache()} is called. Used for derived
 * views of a graph that are expensive to rebuild on every call
 * but must be recomputed after the graph is mutated.
 *
 * @param <T>
 */
public class CachedSupplier<T> implements Supplier<T>{

	private final Supplier<T> c;
	private T cache;
	private boolean run=false;

	public CachedSupplier(final Supplier<T> c){
		this.c=c;
	}

	@Override
	public synchronized T get() {
		if(run) {
			return this.cache;
		}
		this.cache=c.get();
		this.run=true;
		return this.cache;
	}

	public synchronized boolean hasRun(){
		return this.run;
	}

	/**
	 * Flag to signal this instance to recalculate from its
	 * supplier on next call.
	 */
	public synchronized void resetCache(){
		this.run=false;
		this.cache=null;
	}

	public static <T> CachedSupplier<T> of(final Supplier<T> supplier){
		return new CachedSupplier<T>(supplier);
	}
}
