package com.questrail.osc.dispatch;

import com.questrail.osc.OscErrorCode;
import com.questrail.osc.OscException;
import com.questrail.osc.internal.time.FixedWallClock;
import com.questrail.osc.model.OscBundle;
import com.questrail.osc.model.OscMessage;
import com.questrail.osc.model.OscTimeTag;
import com.questrail.osc.model.OscValue;
import com.questrail.osc.observability.OscErrorEvent;
import com.questrail.osc.observability.RecordingErrorHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * OscDispatcherTest
 * -----------------------------------------------------------------------------
 * Routing of messages and bundles to registered methods.
 */
final class OscDispatcherTest
{
    private static final Instant NOW = Instant.parse("2025-06-01T10:00:00Z");

    private RecordingErrorHandler errors;
    private OscDispatcher dispatcher;
    private List<String> calls;

    @BeforeEach
    void setUp()
    {
        errors = new RecordingErrorHandler();
        dispatcher = new OscDispatcher(errors, new FixedWallClock(NOW));
        calls = new ArrayList<>();
    }

    @Test
    void typeSignatureMustPrefixIncomingTags()
    {
        dispatcher.addMethod("/mixer/*", "", m -> calls.add("any"));
        dispatcher.addMethod("/mixer/*", "i", m -> calls.add("int"));
        dispatcher.addMethod("/mixer/*", "f", m -> calls.add("float"));

        int invoked = dispatcher.dispatchMessage(OscMessage.of("/mixer/gain", OscValue.float32(0.5f)));

        assertEquals(2, invoked);
        assertEquals(List.of("any", "float"), calls);
    }

    @Test
    void signatureIsAPrefixNotAnExactMatch()
    {
        dispatcher.addMethod("/x", "if", m -> calls.add("if"));
        dispatcher.addMethod("/x", "ifs", m -> calls.add("ifs"));
        dispatcher.addMethod("/x", "ifsi", m -> calls.add("ifsi"));

        dispatcher.dispatch(OscMessage.builder("/x").addInt32(1).addFloat(2).addString("3").build());

        assertEquals(List.of("if", "ifs"), calls);
    }

    @Test
    void handlersRunInRegistrationOrder()
    {
        dispatcher.addMethod("/a/{b,c}", null, m -> calls.add("first"));
        dispatcher.addMethod("/a/b", null, m -> calls.add("second"));
        dispatcher.addMethod("/a/?", null, m -> calls.add("third"));

        dispatcher.dispatch(OscMessage.of("/a/b"));

        assertEquals(List.of("first", "second", "third"), calls);
    }

    @Test
    void onlyTheFirstDefaultFiresAndOnlyWhenNothingMatched()
    {
        dispatcher.addMethod("/known", "", m -> calls.add("known"));
        dispatcher.addDefaultMethod(m -> calls.add("default1:" + m.path()));
        dispatcher.addDefaultMethod(m -> calls.add("default2"));

        dispatcher.dispatch(OscMessage.of("/known"));
        dispatcher.dispatch(OscMessage.of("/unknown"));

        assertEquals(List.of("known", "default1:/unknown"), calls);
    }

    @Test
    void nonMatchingSpecificHandlerNeverFires()
    {
        dispatcher.addMethod("/mixer/gain", "i", m -> calls.add("specific"));
        dispatcher.addDefaultMethod(m -> calls.add("default"));

        dispatcher.dispatch(OscMessage.of("/mixer/gain", OscValue.float32(1)));

        assertEquals(List.of("default"), calls);
    }

    @Test
    void noMethodAndNoDefaultInvokesNothing()
    {
        assertEquals(0, dispatcher.dispatch(OscMessage.of("/nobody")));
        assertTrue(errors.isEmpty());
    }

    @Test
    void failingHandlerIsReportedAndOthersStillRun()
    {
        dispatcher.addMethod("/x", "", m -> { throw new IllegalStateException("boom"); });
        dispatcher.addMethod("/x", "", m -> calls.add("after"));

        assertEquals(2, dispatcher.dispatch(OscMessage.of("/x")));

        assertEquals(List.of("after"), calls);
        assertEquals(1, errors.events().size());
        OscErrorEvent event = errors.events().get(0);
        assertEquals(OscErrorCode.HANDLER_ERROR, event.code());
        assertEquals(NOW, event.timestamp());
        assertEquals("OscDispatcher.dispatchMessage", event.component());
        assertInstanceOf(IllegalStateException.class, event.cause());
        assertTrue(event.message().contains("boom"));
    }

    @Test
    void removedMethodNoLongerFires()
    {
        OscMethodId id = dispatcher.addMethod("/x", "", m -> calls.add("x"));

        assertTrue(dispatcher.removeMethod(id));
        assertFalse(dispatcher.removeMethod(id));
        dispatcher.dispatch(OscMessage.of("/x"));

        assertTrue(calls.isEmpty());
        assertTrue(dispatcher.methods().isEmpty());
    }

    @Test
    void idsAreDistinct()
    {
        OscMethodId a = dispatcher.addMethod("/a", "", m -> {});
        OscMethodId b = dispatcher.addDefaultMethod(m -> {});
        assertNotEquals(a, b);
        assertEquals(2, dispatcher.methods().size());
        assertTrue(dispatcher.methods().get(1).isDefault());
    }

    @Test
    void invalidRegistrationsFailImmediately()
    {
        assertEquals(OscErrorCode.PATTERN_ERROR,
                assertThrows(OscException.class, () -> dispatcher.addMethod("/a[", "", m -> {})).code());
        assertEquals(OscErrorCode.INVALID_ARGUMENT,
                assertThrows(OscException.class, () -> dispatcher.addMethod("/a", "", null)).code());
        assertEquals(OscErrorCode.INVALID_ARGUMENT,
                assertThrows(OscException.class, () -> dispatcher.addMethod(null, "", m -> {})).code());
        assertEquals(OscErrorCode.INVALID_ARGUMENT,
                assertThrows(OscException.class, () -> dispatcher.addDefaultMethod(null)).code());
    }

    @Test
    void bundleHooksWrapElementsRecursively()
    {
        dispatcher.addMethod("/*", "", m -> calls.add(m.path()));
        dispatcher.setBundleHandlers(
                b -> calls.add("start:" + b.size()),
                b -> calls.add("end:" + b.size()));

        OscBundle bundle = OscBundle.builder(new OscTimeTag(5, 0))
                .addMessage(OscMessage.of("/a"))
                .addBundle(OscBundle.of(OscTimeTag.immediate(), OscMessage.of("/b")))
                .addMessage(OscMessage.of("/c"))
                .build();

        assertEquals(3, dispatcher.dispatch(bundle));
        assertEquals(List.of("start:3", "/a", "start:1", "/b", "end:1", "/c", "end:3"), calls);
    }

    @Test
    void bundleHookReceivesTheBundleTimeTag()
    {
        List<OscTimeTag> tags = new ArrayList<>();
        dispatcher.setBundleHandlers(b -> tags.add(b.timeTag()), null);

        dispatcher.dispatch(OscBundle.of(new OscTimeTag(7, 8)));

        assertEquals(List.of(new OscTimeTag(7, 8)), tags);
    }

    @Test
    void failingHookIsReportedAndElementsStillDispatch()
    {
        dispatcher.addMethod("/a", "", m -> calls.add("a"));
        dispatcher.setBundleHandlers(b -> { throw new RuntimeException("start failed"); }, b -> calls.add("end"));

        dispatcher.dispatch(OscBundle.of(OscTimeTag.immediate(), OscMessage.of("/a")));

        assertEquals(List.of("a", "end"), calls);
        assertEquals(List.of(OscErrorCode.HANDLER_ERROR), errors.codes());
        assertEquals("OscDispatcher.dispatchBundle", errors.events().get(0).component());
    }

    @Test
    void handlerMayRegisterMethodsWhileDispatching()
    {
        dispatcher.addMethod("/register", "", m -> dispatcher.addMethod("/late", "", x -> calls.add("late")));

        dispatcher.dispatch(OscMessage.of("/register"));
        dispatcher.dispatch(OscMessage.of("/late"));

        assertEquals(List.of("late"), calls);
    }

    @Test
    void throwingErrorHandlerDoesNotEscape()
    {
        dispatcher.setErrorHandler(e -> { throw new IllegalStateException("handler broken"); });
        dispatcher.addMethod("/x", "", m -> { throw new RuntimeException("boom"); });

        assertDoesNotThrow(() -> dispatcher.dispatch(OscMessage.of("/x")));
    }
}
