package alpha.chainrouter;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.function.Consumer;

import static alpha.chainrouter.HttpConstants.Method.DELETE;
import static alpha.chainrouter.HttpConstants.Method.GET;
import static alpha.chainrouter.HttpConstants.Method.HEAD;
import static alpha.chainrouter.HttpConstants.Method.POST;
import static alpha.chainrouter.HttpConstants.Method.PUT;
import static alpha.chainrouter.HttpConstants.StatusCode.THREE_HUNDRED_ONE;

/**
 * Default implementation of {@link Config}.
 */
final class DefaultConfig implements Config {
    private final Builder      builder;
    private final int          redirectStatus;
    private final List<String> methodsForAll;
    private final boolean      rejectDuplicateRoutes;
    
    DefaultConfig(Builder b, DefaultBuilder.MutableState s) {
        builder               = b;
        redirectStatus        = s.redirectStatus;
        methodsForAll         = s.methodsForAll;
        rejectDuplicateRoutes = s.rejectDuplicateRoutes;
    }
    
    @Override
    public int redirectStatus() {
        return redirectStatus;
    }
    
    @Override
    public List<String> methodsForAll() {
        return methodsForAll;
    }
    
    @Override
    public boolean rejectDuplicateRoutes() {
        return rejectDuplicateRoutes;
    }
    
    @Override
    public Builder toBuilder() {
        return builder;
    }
    
    @Override
    public String toString() {
        return DefaultConfig.class.getSimpleName() + "{" +
                "redirectStatus=" + redirectStatus + ", " +
                "methodsForAll=" + methodsForAll + ", " +
                "rejectDuplicateRoutes=" + rejectDuplicateRoutes + "}";
    }
    
    /**
     * Builders are backwards-linked in a chain and the only real state they
     * each store is a modifying action, which is replayed against a mutable
     * state container when the config is built.
     */
    static final class DefaultBuilder implements Builder
    {
        static final DefaultBuilder ROOT = new DefaultBuilder();
        
        static class MutableState {
            int          redirectStatus        = THREE_HUNDRED_ONE;
            List<String> methodsForAll         = List.of(DELETE, GET, HEAD, POST, PUT);
            boolean      rejectDuplicateRoutes = false;
        }
        
        private final DefaultBuilder prev;
        private final Consumer<MutableState> modifier;
        
        private DefaultBuilder() {
            prev = null;
            modifier = null;
        }
        
        private DefaultBuilder(DefaultBuilder prev, Consumer<MutableState> modifier) {
            this.prev = prev;
            this.modifier = modifier;
        }
        
        @Override
        public Builder redirectStatus(int newVal) {
            return new DefaultBuilder(this, s -> s.redirectStatus = newVal);
        }
        
        @Override
        public Builder methodsForAll(String... newVal) {
            // List.of NPEs on null elements
            var copy = List.of(newVal);
            if (copy.isEmpty()) {
                throw new IllegalArgumentException("No methods.");
            }
            var seen = new HashSet<String>();
            for (String m : copy) {
                if (m.isEmpty()) {
                    throw new IllegalArgumentException("Empty method.");
                }
                if (!seen.add(m)) {
                    throw new IllegalArgumentException("Repeated method: " + m);
                }
            }
            return new DefaultBuilder(this, s -> s.methodsForAll = copy);
        }
        
        @Override
        public Builder rejectDuplicateRoutes(boolean newVal) {
            return new DefaultBuilder(this, s -> s.rejectDuplicateRoutes = newVal);
        }
        
        @Override
        public Config build() {
            return new DefaultConfig(this, constructState());
        }
        
        private MutableState constructState() {
            Deque<Consumer<MutableState>> mods = new ArrayDeque<>();
            for (var b = this; b.modifier != null; b = b.prev) {
                mods.addFirst(b.modifier);
            }
            MutableState s = new MutableState();
            mods.forEach(m -> m.accept(s));
            return s;
        }
    }
}
