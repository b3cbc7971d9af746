package util;

/**
 * Immutable pair of the given types.
 *
 * @param <F> Type of the first element of the pair
 * @param <S> Type of the second element of the pair
 */
public class OrderedPair<F, S> {

    /**
     * first element
     */
    private final F fst;
    /**
     * second element
     */
    private final S snd;
    private final int memoizedHashCode;

    /**
     * Create a pair from the two given elements
     *
     * @param fst first element of the pair
     * @param snd second element of the pair
     */
    public OrderedPair(F fst, S snd) {
        this.fst = fst;
        this.snd = snd;
        this.memoizedHashCode = computeHashCode();
    }

    public F fst() {
        return fst;
    }

    public S snd() {
        return snd;
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof OrderedPair<?, ?>)) {
            return false;
        }
        OrderedPair<?, ?> other = (OrderedPair<?, ?>) obj;
        return (fst() == null ? other.fst() == null : fst().equals(other.fst()))
                && (snd() == null ? other.snd() == null : snd().equals(other.snd()));
    }

    private int computeHashCode() {
        int firstHash = fst() != null ? fst().hashCode() : 0;
        // flip the bits so (b,a) has a different hash than (a,b)
        return (firstHash >>> 16 | firstHash << 16) ^ (snd() != null ? snd().hashCode() : 0);
    }

    @Override
    public int hashCode() {
        return memoizedHashCode;
    }

    @Override
    public String toString() {
        return "(" + fst() + ", " + snd() + ")";
    }
}
