package alpha.chainrouter.core;

import alpha.chainrouter.Config;
import alpha.chainrouter.DefaultContext;
import alpha.chainrouter.handler.Endpoint;
import alpha.chainrouter.handler.Middleware;
import alpha.chainrouter.route.RouteCollisionException;
import alpha.chainrouter.route.Router;
import alpha.chainrouter.testutil.Invocations;
import alpha.chainrouter.testutil.LogRecorder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static alpha.chainrouter.testutil.TestContexts.ctx;
import static alpha.chainrouter.testutil.TestContexts.delete;
import static alpha.chainrouter.testutil.TestContexts.get;
import static alpha.chainrouter.testutil.TestContexts.head;
import static alpha.chainrouter.testutil.TestContexts.post;
import static alpha.chainrouter.testutil.TestContexts.put;
import static java.lang.System.Logger.Level.DEBUG;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertSame;

/**
 * Small tests of {@link DefaultRouter}.
 */
final class DefaultRouterTest {
    private final Invocations calls = new Invocations();
    private final Router testee = new DefaultRouter(Config.DEFAULT, "");
    private LogRecorder logs;
    
    @BeforeEach
    void startRecording() {
        logs = LogRecorder.startRecording();
    }
    
    @AfterEach
    void stopRecording() {
        try {
            logs.assertNoProblem();
        } finally {
            logs.stopRecording();
        }
    }
    
    private DefaultContext dispatch(DefaultContext ctx) throws Exception {
        testee.routes().accept(ctx);
        return ctx;
    }
    
    @Test
    void match_invokesOnce() throws Exception {
        testee.get("/x", ctx -> {
            calls.endpoint("h").accept(ctx);
            ctx.status(200);
        });
        var ctx = dispatch(get("/x"));
        assertThat(calls.names()).containsExactly("h");
        assertThat(ctx.status()).isEqualTo(200);
    }
    
    @Test
    void miss_leavesUnhandled() throws Exception {
        testee.get("/x", calls.endpoint("h"));
        assertThat(dispatch(get("/y")).isUnhandled()).isTrue();
        assertThat(dispatch(post("/x")).isUnhandled()).isTrue();
        assertThat(dispatch(get("/x/")).isUnhandled()).isTrue();
        assertThat(calls.count()).isZero();
        logs.assertRemove(DEBUG, "Registered route: GET+/x")
            .assertRemove(DEBUG, "No route: GET+/y")
            .assertRemove(DEBUG, "No route: POST+/x")
            .assertRemove(DEBUG, "No route: GET+/x/")
            .assertEmpty();
    }
    
    @Test
    void alreadyHandled_skips() throws Exception {
        testee.get("/x", calls.endpoint("h"));
        var ctx = get("/x");
        ctx.status(200);
        dispatch(ctx);
        assertThat(calls.count()).isZero();
        assertThat(ctx.status()).isEqualTo(200);
        logs.assertRemove(DEBUG, "Already handled (200), skipping: GET /x");
    }
    
    @Test
    void chainRunsInOrder() throws Exception {
        testee.get("/x", calls.step("h1"), calls.step("h2"), calls.step("h3"));
        dispatch(get("/x"));
        assertThat(calls.names()).containsExactly("h1", "h2", "h3");
    }
    
    @Test
    void notProceeding_stopsChain() throws Exception {
        testee.get("/x", calls.stop("h1"), calls.step("h2"), calls.step("h3"));
        dispatch(get("/x"));
        assertThat(calls.names()).containsExactly("h1");
    }
    
    @Test
    void proceedingTwice_runsRemainderTwice() throws Exception {
        testee.get("/x", calls.repeat("h1"), calls.step("h2"), calls.step("h3"));
        dispatch(get("/x"));
        assertThat(calls.names()).containsExactly("h1", "h2", "h3", "h2", "h3");
    }
    
    @Test
    void firstRegistrationWins() throws Exception {
        testee.get("/x", calls.endpoint("A"))
              .get("/x", calls.endpoint("B"));
        dispatch(get("/x"));
        assertThat(calls.names()).containsExactly("A");
        logs.assertContainsOnlyOnce(DEBUG, "Route already registered, ignoring: GET+/x");
    }
    
    @Test
    void rejectDuplicates() {
        var config = Config.configuration().rejectDuplicateRoutes(true).build();
        var r = new DefaultRouter(config, "");
        r.get("/x", calls.endpoint("A"));
        assertThatThrownBy(() -> r.get("/x", calls.endpoint("B")))
            .isExactlyInstanceOf(RouteCollisionException.class)
            .hasMessage("Route \"GET+/x\" is already registered.");
    }
    
    @Test
    void singleMethodRegistrations() throws Exception {
        testee.put("/x", calls.endpoint("put"))
              .head("/x", calls.endpoint("head"))
              .del("/x", calls.endpoint("del"))
              .post("/y", calls.endpoint("post"));
        dispatch(put("/x"));
        dispatch(head("/x"));
        dispatch(delete("/x"));
        dispatch(post("/y"));
        assertThat(calls.names()).containsExactly("put", "head", "del", "post");
        // Registered methods only, and "del" is not a method
        assertThat(dispatch(get("/x")).isUnhandled()).isTrue();
        assertThat(dispatch(post("/x")).isUnhandled()).isTrue();
        assertThat(dispatch(ctx("DEL", "/x")).isUnhandled()).isTrue();
        assertThat(dispatch(put("/y")).isUnhandled()).isTrue();
        assertThat(calls.count()).isEqualTo(4);
    }
    
    @Test
    void all_registersEachMethod() throws Exception {
        testee.all("/x", calls.endpoint("h"));
        for (var ctx : new DefaultContext[]{
                get("/x"), post("/x"), put("/x"), head("/x"), delete("/x")}) {
            dispatch(ctx);
        }
        assertThat(calls.names()).containsExactly("h", "h", "h", "h", "h");
        assertThat(dispatch(ctx("PATCH", "/x")).isUnhandled()).isTrue();
    }
    
    @Test
    void all_sharesOneComposedChain() {
        testee.all("/x", calls.step("a"), calls.step("b"));
        var get = testee.lookup("GET", "/x").orElseThrow();
        assertSame(get, testee.lookup("POST", "/x").orElseThrow());
        assertSame(get, testee.lookup("DELETE", "/x").orElseThrow());
    }
    
    @Test
    void all_configuredMethods() throws Exception {
        var r = new DefaultRouter(
                Config.configuration().methodsForAll("GET", "PATCH").build(), "");
        r.all("/x", calls.endpoint("h"));
        assertThat(r.lookup("PATCH", "/x")).isPresent();
        assertThat(r.lookup("POST", "/x")).isEmpty();
    }
    
    @Test
    void all_doesNotOverwriteExisting() throws Exception {
        testee.get("/x", calls.endpoint("specific"))
              .all("/x", calls.endpoint("any"));
        dispatch(get("/x"));
        dispatch(post("/x"));
        assertThat(calls.names()).containsExactly("specific", "any");
    }
    
    @Test
    void redirect_defaultStatus() throws Exception {
        testee.redirect("/old", "/new");
        var ctx = dispatch(get("/old"));
        assertThat(ctx.status()).isEqualTo(301);
        assertThat(ctx.redirectTarget()).hasValue("/new");
        assertThat(dispatch(post("/old")).status()).isEqualTo(301);
    }
    
    @Test
    void redirect_explicitStatus() throws Exception {
        testee.redirect("/old", "/new", 302);
        assertThat(dispatch(get("/old")).status()).isEqualTo(302);
    }
    
    @Test
    void redirect_configuredStatus() throws Exception {
        var r = new DefaultRouter(
                Config.configuration().redirectStatus(308).build(), "");
        r.redirect("/old", "/new");
        var ctx = get("/old");
        r.routes().accept(ctx);
        assertThat(ctx.status()).isEqualTo(308);
    }
    
    @Test
    void prefix_appliesToRegistrationAndLookup() throws Exception {
        testee.prefix("/api").get("/users", calls.endpoint("users"));
        assertThat(testee.prefix()).isEqualTo("/api");
        assertThat(dispatch(get("/users")).isUnhandled()).isTrue();
        dispatch(get("/api/users"));
        assertThat(calls.names()).containsExactly("users");
    }
    
    @Test
    void prefix_isNotRetroactive() throws Exception {
        testee.get("/a", calls.endpoint("a"))
              .prefix("/v2")
              .get("/b", calls.endpoint("b"));
        dispatch(get("/a"));
        dispatch(get("/v2/b"));
        assertThat(dispatch(get("/v2/a")).isUnhandled()).isTrue();
        assertThat(dispatch(get("/b")).isUnhandled()).isTrue();
        assertThat(calls.names()).containsExactly("a", "b");
    }
    
    @Test
    void lookup_isRelativeToCurrentPrefix() {
        testee.prefix("/v1").get("/a", calls.endpoint("a"));
        assertThat(testee.lookup("GET", "/a")).isPresent();
        testee.prefix("/v2");
        assertThat(testee.lookup("GET", "/a")).isEmpty();
        testee.prefix("");
        assertThat(testee.lookup("GET", "/v1/a")).isPresent();
    }
    
    @Test
    void routes_seesLaterRegistrations() throws Exception {
        Endpoint routes = testee.routes();
        testee.get("/late", calls.endpoint("late"));
        routes.accept(get("/late"));
        assertThat(calls.names()).containsExactly("late");
    }
    
    @Test
    void handlerException_propagates() {
        var boom = new IOException("boom");
        testee.get("/x", calls.step("h1"), (ctx, chain) -> { throw boom; }, calls.step("h3"));
        assertThatThrownBy(() -> dispatch(get("/x"))).isSameAs(boom);
        assertThat(calls.names()).containsExactly("h1");
    }
    
    @Test
    void invalidArguments() {
        assertThatThrownBy(() -> testee.get("/x"))
            .isExactlyInstanceOf(IllegalArgumentException.class)
            .hasMessage("No handlers.");
        assertThatThrownBy(() -> testee.get(null, calls.step("a")))
            .isExactlyInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> testee.get("/x", calls.step("a"), (Middleware) null))
            .isExactlyInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> testee.redirect("/x", null))
            .isExactlyInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> testee.prefix(null))
            .isExactlyInstanceOf(NullPointerException.class);
        assertThat(testee.lookup("GET", "/x")).isEmpty();
    }
    
    @Test
    void toString_listsSortedRoutes() {
        testee.post("/b", calls.endpoint("b"))
              .get("/a", calls.endpoint("a"));
        assertThat(testee).hasToString("DefaultRouter{prefix=, routes=[GET+/a, POST+/b]}");
    }
}
