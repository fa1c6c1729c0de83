package gov.nih.ncats.dugr.util;

import java.util.function.Supplier;

/**
 * Memoized supplier. The delegate is called at most once,
 * on the first {@link #get()}, and its value is returned afterwards.
 *
 * @param <T> the type of the cached value.
 */
public final class CachedSupplier<T> implements Supplier<T>{

	private final Supplier<T> delegate;
	private T cache;
	private volatile boolean run=false;

	private CachedSupplier(final Supplier<T> delegate){
		this.delegate=delegate;
	}

	public static <T> CachedSupplier<T> of(final Supplier<T> supplier){
		return new CachedSupplier<>(supplier);
	}

	@Override
	public T get() {
		if(run) {
			return cache;
		}
		synchronized(this){
			if(!run){
				cache=delegate.get();
				run=true;
			}
			return cache;
		}
	}
}
