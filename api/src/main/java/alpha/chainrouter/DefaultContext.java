package alpha.chainrouter;

import java.util.Optional;

import static alpha.chainrouter.HttpConstants.StatusCode.FOUR_HUNDRED_FOUR;
import static java.util.Objects.requireNonNull;

/**
 * A plain, in-memory {@link Context}.<p>
 * 
 * Useful for embedding a router into an existing server that has its own
 * request and response types, as well as for tests. The initial status is
 * {@value HttpConstants.StatusCode#FOUR_HUNDRED_FOUR}; unhandled.<p>
 * 
 * This class is not thread-safe. The instance is expected to be confined to
 * the thread dispatching the exchange.
 */
public final class DefaultContext implements Context
{
    private final String method, path;
    private int status;
    private String redirect;
    
    /**
     * Constructs a {@code DefaultContext}.
     * 
     * @param method of request
     * @param path of request
     * 
     * @throws NullPointerException if any argument is {@code null}
     */
    public DefaultContext(String method, String path) {
        this.method = requireNonNull(method);
        this.path   = requireNonNull(path);
        this.status = FOUR_HUNDRED_FOUR;
    }
    
    @Override
    public String method() {
        return method;
    }
    
    @Override
    public String path() {
        return path;
    }
    
    @Override
    public int status() {
        return status;
    }
    
    @Override
    public void status(int status) {
        this.status = status;
    }
    
    @Override
    public void redirect(String destination) {
        redirect = requireNonNull(destination);
    }
    
    /**
     * Returns the redirect target.
     * 
     * @return the redirect target, if one has been set
     */
    public Optional<String> redirectTarget() {
        return Optional.ofNullable(redirect);
    }
    
    /**
     * Returns whether this context is still unhandled.<p>
     * 
     * Same as {@code status() == 404}.
     * 
     * @return whether this context is still unhandled
     */
    public boolean isUnhandled() {
        return status == FOUR_HUNDRED_FOUR;
    }
    
    @Override
    public String toString() {
        return DefaultContext.class.getSimpleName() + "{" +
                "method=" + method + ", " +
                "path=" + path + ", " +
                "status=" + status + ", " +
                "redirect=" + redirect + "}";
    }
}
