package io.bptree.collections.bplustree;

import java.util.Comparator;
import java.util.function.BiFunction;

/**
 * Read-only sequence view that node contents are built from. Transforms return lazy views over their source; call
 * {@link #copy()} to flatten a chain of views before it is stored in a node.
 */
public interface ArrayLike<T> {
    int size();

    T get(int i);

    default ArrayLike<T> copy() {
        final int n = size();
        final Object[] arr = new Object[n];
        copyTo(0, arr, 0, n);
        return new ArrayWrapper<>(arr);
    }

    void copyTo(int srcPos, Object[] dst, int dstPos, int length);

    default <A> A fold(BiFunction<T, A, A> f, A a) {
        final int n = size();
        for (int i = 0; i < n; i++) {
            a = f.apply(get(i), a);
        }
        return a;
    }

    default T first() {
        return get(0);
    }

    default T last() {
        return get(size() - 1);
    }

    default boolean isEmpty() {
        return size() == 0;
    }

    /**
     * Binary search over a sequence sorted by {@code c}. Returns the index of {@code t} when present, otherwise
     * {@code -(insertionPoint) - 1}, following {@link java.util.Arrays#binarySearch(Object[], Object, Comparator)}.
     */
    default int search(T t, Comparator<? super T> c) {
        int lo = 0;
        int hi = size() - 1;
        while (lo <= hi) {
            final int mid = (lo + hi) >>> 1;
            final int cmp = c.compare(get(mid), t);
            if (cmp < 0) {
                lo = mid + 1;
            } else if (cmp > 0) {
                hi = mid - 1;
            } else {
                return mid;
            }
        }
        return -(lo + 1);
    }

    // transforms

    default ArrayLike<T> sliceFrom(int i) {
        return new Slice<>(this, i, size());
    }

    default ArrayLike<T> sliceTo(int i) {
        return new Slice<>(this, 0, i);
    }

    default ArrayLike<T> spliceIn(int i, T t) {
        return sliceTo(i).concat(wrap(t)).concat(sliceFrom(i));
    }

    default ArrayLike<T> concat(ArrayLike<T> other) {
        return new Concat<>(this, other);
    }

    default ArrayLike<T> with(int i, T value) {
        return new With<>(this, i, value);
    }

    // constructors

    @SafeVarargs  // ts may have run-time type Object[]
    static <T> ArrayLike<T> wrap(T... ts) {
        return new ArrayWrapper<>(ts);
    }

    static <T> ArrayLike<T> empty() {
        return wrap();
    }

    class Slice<T> implements ArrayLike<T> {
        final ArrayLike<T> delegate;
        final int from;
        final int to;

        // to is clamped to the delegate's size and from to to, so a slice is never negative-sized
        public Slice(ArrayLike<T> delegate, int from, int to) {
            if (from < 0) {
                throw new IllegalArgumentException("negative slice start " + from);
            }
            this.delegate = delegate;
            this.to = Math.min(to, delegate.size());
            this.from = Math.min(from, this.to);
        }

        @Override
        public int size() {
            return to - from;
        }

        @Override
        public T get(int i) {
            if (i < 0 || i >= size()) {
                throw new IndexOutOfBoundsException("index " + i + " of slice [" + from + ", " + to + ")");
            }
            return delegate.get(from + i);
        }

        @Override
        public void copyTo(int srcPos, Object[] dst, int dstPos, int length) {
            if (srcPos < 0 || srcPos + length > size()) {
                throw new IndexOutOfBoundsException(
                        "range [" + srcPos + ", " + (srcPos + length) + ") of slice of size " + size());
            }
            delegate.copyTo(from + srcPos, dst, dstPos, length);
        }
    }

    class ArrayWrapper<T> implements ArrayLike<T> {
        final Object[] ts;  // see wrap for why this is Object[] not T[]

        ArrayWrapper(Object[] ts) {
            this.ts = ts;
        }

        @Override
        public int size() {
            return ts.length;
        }

        @SuppressWarnings("unchecked")
        @Override
        public T get(int i) {
            return (T) ts[i];
        }

        // already flat, and wrapped arrays are never written to after wrapping
        @Override
        public ArrayLike<T> copy() {
            return this;
        }

        @Override
        public void copyTo(int srcPos, Object[] dst, int dstPos, int length) {
            System.arraycopy(ts, srcPos, dst, dstPos, length);
        }
    }

    class With<T> implements ArrayLike<T> {
        final ArrayLike<T> delegate;
        final int i;
        final T t;

        With(ArrayLike<T> delegate, int i, T t) {
            if (i < 0 || i >= delegate.size()) {
                throw new IndexOutOfBoundsException();
            }
            this.delegate = delegate;
            this.i = i;
            this.t = t;
        }

        @Override
        public int size() {
            return delegate.size();
        }

        @Override
        public T get(int j) {
            if (j == i) {
                return t;
            }
            return delegate.get(j);
        }

        @Override
        public void copyTo(int srcPos, Object[] dst, int dstPos, int length) {
            delegate.copyTo(srcPos, dst, dstPos, length);
            if (i >= srcPos && i < srcPos + length) {
                dst[dstPos + i - srcPos] = t;
            }
        }
    }

    class Concat<T> implements ArrayLike<T> {
        final ArrayLike<T> head;
        final ArrayLike<T> tail;
        final int headSize;

        Concat(ArrayLike<T> head, ArrayLike<T> tail) {
            this.head = head;
            this.tail = tail;
            this.headSize = head.size();
        }

        @Override
        public int size() {
            return headSize + tail.size();
        }

        @Override
        public T get(int i) {
            return i < headSize ? head.get(i) : tail.get(i - headSize);
        }

        // copies the part of [srcPos, srcPos + length) that falls in head, then the rest from tail
        @Override
        public void copyTo(int srcPos, Object[] dst, int dstPos, int length) {
            if (srcPos < 0 || srcPos + length > size()) {
                throw new IndexOutOfBoundsException(
                        "range [" + srcPos + ", " + (srcPos + length) + ") of sequence of size " + size());
            }
            final int fromHead = Math.max(0, Math.min(length, headSize - srcPos));
            if (fromHead > 0) {
                head.copyTo(srcPos, dst, dstPos, fromHead);
            }
            if (length > fromHead) {
                tail.copyTo(srcPos + fromHead - headSize, dst, dstPos + fromHead, length - fromHead);
            }
        }
    }
}
