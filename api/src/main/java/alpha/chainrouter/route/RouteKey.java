package alpha.chainrouter.route;

import static java.util.Objects.requireNonNull;

/**
 * The key of a route in a router's dispatch table.<p>
 * 
 * The key is the literal concatenation of the method, {@value #SEPARATOR}, the
 * router's prefix and the path; for example "GET+/api/users". Two keys are
 * equal if their strings are equal. There is no normalization of any kind.
 * 
 * @param value the concatenated key
 */
public record RouteKey(String value)
{
    /**
     * The string between the method and the path.
     */
    public static final String SEPARATOR = "+";
    
    /**
     * Constructs this object.
     * 
     * @param value the concatenated key
     * 
     * @throws NullPointerException if {@code value} is {@code null}
     */
    public RouteKey {
        requireNonNull(value);
    }
    
    /**
     * Creates a {@code RouteKey}.
     * 
     * @param method of request
     * @param prefix of router
     * @param path of request
     * 
     * @return a route key
     * 
     * @throws NullPointerException if any argument is {@code null}
     */
    public static RouteKey of(String method, String prefix, String path) {
        requireNonNull(method);
        requireNonNull(prefix);
        requireNonNull(path);
        return new RouteKey(method + SEPARATOR + prefix + path);
    }
    
    @Override
    public String toString() {
        return value;
    }
}
