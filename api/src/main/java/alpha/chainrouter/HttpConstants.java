package alpha.chainrouter;

/**
 * Namespace of constants related to the HTTP protocol.
 */
public final class HttpConstants {
    private HttpConstants() {
        // Empty
    }
    
    /**
     * HTTP methods for which the {@code Router} has a registration method.<p>
     * 
     * The method is a case-sensitive string and can be anything. Routes for
     * other methods than these can not be registered through the router's
     * facade, but they can be targeted by {@code Config.methodsForAll()}.
     * 
     * @see <a href="https://www.iana.org/assignments/http-methods">IANA method registry</a>
     */
    public static final class Method {
        private Method() {
            // Private
        }
        
        /**
         * Used to retrieve a server resource.
         * 
         * @see <a href="https://tools.ietf.org/html/rfc7231#section-4.3.1">RFC 7231 §4.3.1</a>
         */
        public static final String GET = "GET";
        
        /**
         * Same as {@link #GET}, except the response must exclude the message
         * body.
         * 
         * @see <a href="https://tools.ietf.org/html/rfc7231#section-4.3.2">RFC 7231 §4.3.2</a>
         */
        public static final String HEAD = "HEAD";
        
        /**
         * Transmits data to a target processor on the server.
         * 
         * @see <a href="https://tools.ietf.org/html/rfc7231#section-4.3.3">RFC 7231 §4.3.3</a>
         */
        public static final String POST = "POST";
        
        /**
         * Creates or replaces the target resource with the enclosed
         * representation.
         * 
         * @see <a href="https://tools.ietf.org/html/rfc7231#section-4.3.4">RFC 7231 §4.3.4</a>
         */
        public static final String PUT = "PUT";
        
        /**
         * Removes the target resource.
         * 
         * @see <a href="https://tools.ietf.org/html/rfc7231#section-4.3.5">RFC 7231 §4.3.5</a>
         */
        public static final String DELETE = "DELETE";
    }
    
    /**
     * Status codes used by the router and commonly set by handlers.<p>
     * 
     * The names are the numbers spelled out. Reason phrases are the concern of
     * the response-writing server.
     */
    public static final class StatusCode {
        private StatusCode() {
            // Private
        }
        
        /**
         * {@value} (OK).
         * 
         * @see <a href="https://tools.ietf.org/html/rfc7231#section-6.3.1">RFC 7231 §6.3.1</a>
         */
        public static final int TWO_HUNDRED = 200;
        
        /**
         * {@value} (No Content).
         * 
         * @see <a href="https://tools.ietf.org/html/rfc7231#section-6.3.5">RFC 7231 §6.3.5</a>
         */
        public static final int TWO_HUNDRED_FOUR = 204;
        
        /**
         * {@value} (Moved Permanently).<p>
         * 
         * The default status of a router redirect.
         * 
         * @see <a href="https://tools.ietf.org/html/rfc7231#section-6.4.2">RFC 7231 §6.4.2</a>
         */
        public static final int THREE_HUNDRED_ONE = 301;
        
        /**
         * {@value} (Found).
         * 
         * @see <a href="https://tools.ietf.org/html/rfc7231#section-6.4.3">RFC 7231 §6.4.3</a>
         */
        public static final int THREE_HUNDRED_TWO = 302;
        
        /**
         * {@value} (Temporary Redirect).
         * 
         * @see <a href="https://tools.ietf.org/html/rfc7231#section-6.4.7">RFC 7231 §6.4.7</a>
         */
        public static final int THREE_HUNDRED_SEVEN = 307;
        
        /**
         * {@value} (Permanent Redirect).
         * 
         * @see <a href="https://tools.ietf.org/html/rfc7538#section-3">RFC 7538 §3</a>
         */
        public static final int THREE_HUNDRED_EIGHT = 308;
        
        /**
         * {@value} (Unauthorized).
         * 
         * @see <a href="https://tools.ietf.org/html/rfc7235#section-3.1">RFC 7235 §3.1</a>
         */
        public static final int FOUR_HUNDRED_ONE = 401;
        
        /**
         * {@value} (Forbidden).
         * 
         * @see <a href="https://tools.ietf.org/html/rfc7231#section-6.5.3">RFC 7231 §6.5.3</a>
         */
        public static final int FOUR_HUNDRED_THREE = 403;
        
        /**
         * {@value} (Not Found).<p>
         * 
         * A {@link Context} with this status is considered unhandled. A router
         * will only dispatch a context that has this status.
         * 
         * @see <a href="https://tools.ietf.org/html/rfc7231#section-6.5.4">RFC 7231 §6.5.4</a>
         */
        public static final int FOUR_HUNDRED_FOUR = 404;
    }
}
