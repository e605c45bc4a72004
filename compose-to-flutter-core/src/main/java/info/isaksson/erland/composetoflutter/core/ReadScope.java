package info.isaksson.erland.composetoflutter.core;

/**
 * Hook around the analysis of one unit, for hosts that guard access to the source model
 * (an IDE read lock, for example).
 *
 * <p>{@link ConversionService} acquires the scope before extracting a unit and releases it
 * afterwards, also on failure. A scope is never held across units.</p>
 */
public interface ReadScope {

    ReadScope NONE = new ReadScope() {
        @Override
        public void acquire(String unitPath) {
            // nothing to guard
        }

        @Override
        public void release(String unitPath) {
            // nothing to guard
        }
    };

    void acquire(String unitPath);

    void release(String unitPath);
}
