package com.example.compliance.gateway;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ResilientTransportTest {

    private static final Duration BASE = Duration.ofSeconds(1);
    private static final Duration JITTER = Duration.ofMillis(500);

    private MutableClock clock;
    private AtomicInteger exchanges;
    private CredentialManager credentials;
    private List<Duration> sleeps;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-03-01T10:00:00Z"));
        exchanges = new AtomicInteger();
        credentials = new CredentialManager("secret",
                secret -> new IssuedToken("token-" + exchanges.incrementAndGet(),
                        clock.instant().plus(Duration.ofHours(1)).toEpochMilli()),
                Duration.ofMinutes(5), clock);
        sleeps = new ArrayList<>();
    }

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    private ResilientTransport transport(int maxAttempts, double jitterFraction) {
        return new ResilientTransport(new RetryPolicy(maxAttempts, BASE, JITTER, Duration.ofSeconds(60)),
                credentials, sleeps::add, () -> jitterFraction);
    }

    private static ResourceAccessException connectionRefused() {
        return new ResourceAccessException("I/O error on POST request: Connection refused");
    }

    private static HttpClientErrorException status(HttpStatus status) {
        return HttpClientErrorException.create(status, status.getReasonPhrase(), HttpHeaders.EMPTY,
                "{\"message\":\"rejected\"}".getBytes(StandardCharsets.UTF_8), StandardCharsets.UTF_8);
    }

    @Nested
    @DisplayName("transient failures")
    class TransientTests {

        @Test
        @DisplayName("makes exactly maxAttempts attempts and reports them")
        void exhaustsAttempts() {
            AtomicInteger calls = new AtomicInteger();

            TransportException error = assertThrows(TransportException.class,
                    () -> transport(5, 0.0).execute("op", token -> {
                        calls.incrementAndGet();
                        throw connectionRefused();
                    }));

            assertEquals(5, calls.get());
            assertEquals(5, error.attempts());
            assertFalse(error.isCancelled());
            assertInstanceOf(ResourceAccessException.class, error.getCause());
            assertEquals(4, sleeps.size(), "no sleep after the last attempt");
        }

        @Test
        @DisplayName("backoff before attempt k+1 is at least d*2^(k-1) and below that plus the jitter bound")
        void exponentialBackoffWithJitter() {
            assertThrows(TransportException.class,
                    () -> transport(5, 0.999).execute("op", token -> {
                        throw connectionRefused();
                    }));

            for (int k = 1; k <= sleeps.size(); k++) {
                long floor = BASE.toMillis() * (1L << (k - 1));
                long actual = sleeps.get(k - 1).toMillis();
                assertTrue(actual >= floor, "attempt " + k + " slept " + actual);
                assertTrue(actual < floor + JITTER.toMillis(), "attempt " + k + " slept " + actual);
            }
        }

        @Test
        @DisplayName("returns the value and the attempt count once a retry succeeds")
        void succeedsAfterRetries() {
            AtomicInteger calls = new AtomicInteger();

            ResilientTransport.Delivery<String> delivery = transport(5, 0.0).execute("op", token -> {
                if (calls.incrementAndGet() < 3) {
                    throw connectionRefused();
                }
                return "done";
            });

            assertEquals("done", delivery.value());
            assertEquals(3, delivery.attempts());
            assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(2)), sleeps);
        }

        @Test
        @DisplayName("401 invalidates the token used for the attempt and retries with a fresh one")
        void unauthorizedRefreshesToken() {
            List<String> seenTokens = new ArrayList<>();

            ResilientTransport.Delivery<String> delivery = transport(3, 0.0).execute("op", token -> {
                seenTokens.add(token);
                if (token.equals("token-1")) {
                    throw status(HttpStatus.UNAUTHORIZED);
                }
                return "ok";
            });

            assertEquals("ok", delivery.value());
            assertEquals(List.of("token-1", "token-2"), seenTokens);
            assertEquals(2, exchanges.get());
        }

        @Test
        @DisplayName("an unreachable auth endpoint uses up an attempt and the next attempt refreshes the token")
        void tokenExchangeBlipRetried() {
            AtomicInteger exchangeCalls = new AtomicInteger();
            var flaky = new CredentialManager("secret", secret -> {
                if (exchangeCalls.incrementAndGet() == 1) {
                    throw new ResourceAccessException("I/O error on POST request for \"https://auth.test\"");
                }
                return new IssuedToken("fresh", clock.instant().plus(Duration.ofHours(1)).toEpochMilli());
            }, Duration.ofMinutes(5), clock);
            var transport = new ResilientTransport(new RetryPolicy(3, BASE, JITTER, Duration.ofSeconds(60)),
                    flaky, sleeps::add, () -> 0.0);
            List<String> seenTokens = new ArrayList<>();

            ResilientTransport.Delivery<String> delivery = transport.execute("op", token -> {
                seenTokens.add(token);
                return "ok";
            });

            assertEquals("ok", delivery.value());
            assertEquals(2, delivery.attempts());
            assertEquals(2, exchangeCalls.get());
            assertEquals(List.of("fresh"), seenTokens);
            assertEquals(List.of(BASE), sleeps);
        }

        @Test
        @DisplayName("an auth endpoint that stays unreachable exhausts the attempts")
        void tokenExchangeUnreachableExhausts() {
            var down = new CredentialManager("secret", secret -> {
                throw new ResourceAccessException("Connection refused");
            }, Duration.ofMinutes(5), clock);
            var transport = new ResilientTransport(new RetryPolicy(3, BASE, JITTER, Duration.ofSeconds(60)),
                    down, sleeps::add, () -> 0.0);
            AtomicInteger calls = new AtomicInteger();

            TransportException error = assertThrows(TransportException.class,
                    () -> transport.execute("op", token -> calls.incrementAndGet()));

            assertEquals(3, error.attempts());
            assertInstanceOf(ResourceAccessException.class, error.getCause());
            assertEquals(0, calls.get());
        }

        @Test
        @DisplayName("403 persisting through every attempt ends in TransportException carrying the response")
        void forbiddenExhausts() {
            TransportException error = assertThrows(TransportException.class,
                    () -> transport(2, 0.0).execute("op", token -> {
                        throw status(HttpStatus.FORBIDDEN);
                    }));

            assertEquals(2, error.attempts());
            assertInstanceOf(HttpClientErrorException.class, error.getCause());
        }
    }

    @Nested
    @DisplayName("fatal failures")
    class FatalTests {

        @Test
        @DisplayName("400 is rethrown unchanged without retry")
        void badRequestNotRetried() {
            AtomicInteger calls = new AtomicInteger();
            HttpClientErrorException rejected = status(HttpStatus.BAD_REQUEST);

            HttpClientErrorException error = assertThrows(HttpClientErrorException.class,
                    () -> transport(5, 0.0).execute("op", token -> {
                        calls.incrementAndGet();
                        throw rejected;
                    }));

            assertSame(rejected, error);
            assertEquals(1, calls.get());
            assertTrue(sleeps.isEmpty());
        }

        @Test
        @DisplayName("500 and 429 are not retried")
        void serverErrorsNotRetried() {
            AtomicInteger calls = new AtomicInteger();

            assertThrows(HttpServerErrorException.class, () -> transport(5, 0.0).execute("op", token -> {
                calls.incrementAndGet();
                throw HttpServerErrorException.create(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                        HttpHeaders.EMPTY, new byte[0], StandardCharsets.UTF_8);
            }));
            assertThrows(HttpClientErrorException.class, () -> transport(5, 0.0).execute("op", token -> {
                calls.incrementAndGet();
                throw status(HttpStatus.TOO_MANY_REQUESTS);
            }));

            assertEquals(2, calls.get());
        }

        @Test
        @DisplayName("a failing token exchange propagates before the call is made")
        void authFailurePropagates() {
            var broken = new CredentialManager("secret", secret -> {
                throw new AuthException("invalid credentials");
            }, Duration.ZERO, clock);
            var transport = new ResilientTransport(new RetryPolicy(5, BASE, JITTER, Duration.ofSeconds(60)),
                    broken, sleeps::add, () -> 0.0);
            AtomicInteger calls = new AtomicInteger();

            AuthException error = assertThrows(AuthException.class,
                    () -> transport.execute("op", token -> calls.incrementAndGet()));
            assertEquals(0, calls.get());
            assertEquals(1, error.attempts());
            assertTrue(sleeps.isEmpty());
        }

        @Test
        @DisplayName("a rejected token exchange after a retried failure reports the attempt it ended on")
        void authFailureCarriesAttempt() {
            AtomicInteger exchangeCalls = new AtomicInteger();
            var manager = new CredentialManager("secret", secret -> {
                int n = exchangeCalls.incrementAndGet();
                if (n == 1) {
                    return new IssuedToken("token-1", clock.instant().plus(Duration.ofHours(1)).toEpochMilli());
                }
                throw new AuthException("Token exchange rejected with HTTP 401");
            }, Duration.ofMinutes(5), clock);
            var transport = new ResilientTransport(new RetryPolicy(5, BASE, JITTER, Duration.ofSeconds(60)),
                    manager, sleeps::add, () -> 0.0);

            AuthException error = assertThrows(AuthException.class, () -> transport.execute("op", token -> {
                throw status(HttpStatus.UNAUTHORIZED);
            }));

            assertEquals(2, error.attempts());
            assertTrue(error.getMessage().contains("401"));
        }
    }

    @Nested
    @DisplayName("cancellation")
    class CancellationTests {

        @Test
        @DisplayName("an interrupted thread makes no attempt")
        void interruptedBeforeStart() {
            AtomicInteger calls = new AtomicInteger();
            Thread.currentThread().interrupt();

            TransportException error = assertThrows(TransportException.class,
                    () -> transport(5, 0.0).execute("op", token -> calls.incrementAndGet()));

            assertTrue(error.isCancelled());
            assertEquals(0, calls.get());
        }

        @Test
        @DisplayName("an interrupt during backoff stops retrying and keeps the interrupt flag")
        void interruptedDuringBackoff() {
            var transport = new ResilientTransport(new RetryPolicy(5, BASE, JITTER, Duration.ofSeconds(60)),
                    credentials, duration -> {
                        throw new InterruptedException("cancelled");
                    }, () -> 0.0);
            AtomicInteger calls = new AtomicInteger();

            TransportException error = assertThrows(TransportException.class,
                    () -> transport.execute("op", token -> {
                        calls.incrementAndGet();
                        throw connectionRefused();
                    }));

            assertTrue(error.isCancelled());
            assertEquals(1, calls.get());
            assertTrue(Thread.currentThread().isInterrupted());
        }

        @Test
        @DisplayName("a call aborted by an interrupt is not retried")
        void interruptedCall() {
            AtomicInteger calls = new AtomicInteger();

            TransportException error = assertThrows(TransportException.class,
                    () -> transport(5, 0.0).execute("op", token -> {
                        calls.incrementAndGet();
                        Thread.currentThread().interrupt();
                        throw new ResourceAccessException("Request was interrupted");
                    }));

            assertTrue(error.isCancelled());
            assertEquals(1, calls.get());
            assertTrue(sleeps.isEmpty());
        }
    }
}
