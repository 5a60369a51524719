package com.gs.ep.pagetranslator.model.translation;

import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.junit.jupiter.api.Test;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

public class TranslationServiceTest {

    /**
     * Provider answering from a script of per-call responses; the last response repeats.
     */
    static final class ScriptedProvider implements TranslationProvider {
        private final String name;
        private final Deque<Function<String, ProviderResult>> script = new ArrayDeque<>();
        final AtomicInteger calls = new AtomicInteger();

        ScriptedProvider(String name) {
            this.name = name;
        }

        ScriptedProvider then(Function<String, ProviderResult> response) {
            script.add(response);
            return this;
        }

        ScriptedProvider echoing() {
            return then(text -> ProviderResult.success(text, name));
        }

        ScriptedProvider failingTransiently() {
            return then(text -> ProviderResult.failure(ProviderError.transientError(name, "HTTP 503", null)));
        }

        ScriptedProvider translatingTo(String translation) {
            return then(text -> ProviderResult.success(translation, name));
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public ProviderResult translate(String text) {
            calls.incrementAndGet();
            Function<String, ProviderResult> response = script.size() > 1 ? script.poll() : script.peek();
            return response.apply(text);
        }
    }

    private final MutableList<Long> sleeps = Lists.mutable.empty();
    private final Sleeper recordingSleeper = sleeps::add;

    private TranslationService service(TranslationProvider... providers) {
        return new TranslationService(Lists.mutable.with(providers), 4, 1.5, recordingSleeper);
    }

    @Test
    void translate_primarySucceeds_shouldNotTouchFallbacks() throws TranslationException {
        ScriptedProvider primary = new ScriptedProvider("primary").translatingTo("Habari dunia");
        ScriptedProvider fallback = new ScriptedProvider("fallback").translatingTo("unused");

        assertEquals("Habari dunia", service(primary, fallback).translate("Hello world"));
        assertEquals(1, primary.calls.get());
        assertEquals(0, fallback.calls.get());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void translate_allProvidersEcho_shouldCallEachMaxRetriesPlusOneTimesThenThrow() {
        ScriptedProvider primary = new ScriptedProvider("primary").echoing();
        ScriptedProvider second = new ScriptedProvider("second").echoing();
        ScriptedProvider third = new ScriptedProvider("third").echoing();

        TranslationException e = assertThrows(TranslationException.class,
                () -> service(primary, second, third).translate("Hello world"));

        assertEquals(5, primary.calls.get());
        assertEquals(5, second.calls.get());
        assertEquals(5, third.calls.get());
        assertEquals(15, e.getAttempts());
        assertEquals(ProviderError.Kind.DEGENERATE, e.getLastError().getKind());
        assertEquals("third", e.getLastError().getProviderName());
    }

    @Test
    void translate_primaryDegenerates_shouldTakeFirstAcceptedFallbackImmediately() throws TranslationException {
        ScriptedProvider primary = new ScriptedProvider("primary").echoing();
        ScriptedProvider second = new ScriptedProvider("second").then(text -> ProviderResult.success("  ", "second"));
        ScriptedProvider third = new ScriptedProvider("third").translatingTo("Habari");

        assertEquals("Habari", service(primary, second, third).translate("Hello"));
        assertEquals(1, primary.calls.get());
        assertEquals(1, second.calls.get());
        assertEquals(1, third.calls.get());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void translate_echoWithDifferentWhitespace_shouldStillCountAsDegenerate() throws TranslationException {
        ScriptedProvider primary = new ScriptedProvider("primary")
                .then(text -> ProviderResult.success("  " + text + "\n", "primary"))
                .translatingTo("Habari");

        assertEquals("Habari", service(primary).translate("Hello"));
        assertEquals(2, primary.calls.get());
    }

    @Test
    void translate_transientFailures_shouldBackOffExponentially() throws TranslationException {
        ScriptedProvider primary = new ScriptedProvider("primary")
                .failingTransiently()
                .failingTransiently()
                .failingTransiently()
                .translatingTo("Habari");
        ScriptedProvider fallback = new ScriptedProvider("fallback").translatingTo("fallback text");

        assertEquals("Habari", service(primary, fallback).translate("Hello"));
        assertEquals(Lists.mutable.with(1500L, 3000L, 6000L), sleeps);
        assertEquals(0, fallback.calls.get(), "transient failures must not trigger the correction sweep");
    }

    @Test
    void translate_primaryExhausted_shouldFinishWithFullChainSweep() throws TranslationException {
        ScriptedProvider primary = new ScriptedProvider("primary").failingTransiently();
        ScriptedProvider fallback = new ScriptedProvider("fallback").translatingTo("Habari");

        assertEquals("Habari", service(primary, fallback).translate("Hello"));
        assertEquals(5, primary.calls.get());
        assertEquals(1, fallback.calls.get());
        assertEquals(3, sleeps.size(), "no backoff after the last attempt");
    }

    @Test
    void translate_providerThrows_shouldBeTreatedAsFatalFailure() {
        TranslationProvider broken = new TranslationProvider() {
            @Override
            public String name() {
                return "broken";
            }

            @Override
            public ProviderResult translate(String text) {
                throw new IllegalStateException("boom");
            }
        };

        TranslationException e = assertThrows(TranslationException.class, () -> service(broken).translate("Hello"));
        assertEquals(ProviderError.Kind.FATAL, e.getLastError().getKind());
        assertTrue(e.getCause() instanceof IllegalStateException);
    }

    @Test
    void translate_blankInput_shouldReturnEmptyWithoutCallingProviders() throws TranslationException {
        ScriptedProvider primary = new ScriptedProvider("primary").translatingTo("x");

        assertEquals("", service(primary).translate("   \n"));
        assertEquals(0, primary.calls.get());
    }

    @Test
    void translate_attemptListener_shouldSeeEveryCall() throws TranslationException {
        ScriptedProvider primary = new ScriptedProvider("primary").failingTransiently().translatingTo("Habari");
        MutableList<ProviderResult> seen = Lists.mutable.empty();

        service(primary).translate("Hello", seen::add);

        assertEquals(2, seen.size());
        assertFalse(seen.get(0).isSuccess());
        assertTrue(seen.get(1).isSuccess());
    }

    @Test
    void translate_interruptedDuringBackoff_shouldThrowAndKeepInterruptFlag() {
        ScriptedProvider primary = new ScriptedProvider("primary").failingTransiently();
        TranslationService service = new TranslationService(Lists.mutable.with(primary), 4, 1.5, millis -> {
            throw new InterruptedException();
        });

        assertThrows(TranslationException.class, () -> service.translate("Hello"));
        assertTrue(Thread.interrupted());
        assertEquals(1, primary.calls.get());
    }

    @Test
    void sweep_shouldReturnFirstAcceptedResultWithoutBackoff() {
        ScriptedProvider primary = new ScriptedProvider("primary").failingTransiently();
        ScriptedProvider fallback = new ScriptedProvider("fallback").translatingTo("Habari");

        ProviderResult result = service(primary, fallback).sweep("Hello");

        assertTrue(result.isSuccess());
        assertEquals("Habari", result.getText());
        assertEquals("fallback", result.getProviderName());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void sweep_allFail_shouldCarryLastError() {
        ScriptedProvider primary = new ScriptedProvider("primary").failingTransiently();
        ScriptedProvider fallback = new ScriptedProvider("fallback").echoing();

        ProviderResult result = service(primary, fallback).sweep("Hello");

        assertFalse(result.isSuccess());
        assertEquals(ProviderError.Kind.DEGENERATE, result.getError().getKind());
    }

    @Test
    void constructor_invalidArguments_shouldThrow() {
        ScriptedProvider primary = new ScriptedProvider("primary").echoing();
        assertThrows(IllegalArgumentException.class,
                () -> new TranslationService(Lists.mutable.empty(), 4, 1.5, recordingSleeper));
        assertThrows(IllegalArgumentException.class,
                () -> new TranslationService(Lists.mutable.with(primary), 0, 1.5, recordingSleeper));
    }
}
