package com.padelrank.padelrank_api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.padelrank.padelrank_api.model.Pair;
import com.padelrank.padelrank_api.model.Player;
import com.padelrank.padelrank_api.repository.PairRepository;
import com.padelrank.padelrank_api.repository.PlayerRepository;
import com.padelrank.padelrank_api.security.JwtUtil;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInstance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.messaging.converter.MappingJackson2MessageConverter;
import org.springframework.messaging.simp.stomp.StompFrameHandler;
import org.springframework.messaging.simp.stomp.StompHeaders;
import org.springframework.messaging.simp.stomp.StompSession;
import org.springframework.messaging.simp.stomp.StompSessionHandlerAdapter;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.messaging.WebSocketStompClient;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Base class for integration tests.
 *
 * Boots the full Spring context once per concrete test class with real HTTP,
 * real STOMP WebSocket connections, and PostgreSQL via Testcontainers. Skipped
 * when no Docker daemon is available.
 *
 * Usage in concrete test classes:
 * <pre>
 *   SeededPair challenger = seedPair("Masculino B", 5);
 *   SeededPair challenged = seedPair("Masculino B", 3);
 *   PlayerSession session = connectAsPlayer(challenged.captainToken());
 *
 *   httpPost("/api/challenges", Map.of(...), challenger.captainToken());
 *   Map&lt;?, ?&gt; update = session.updates().poll(2, TimeUnit.SECONDS);
 * </pre>
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
@Testcontainers(disabledWithoutDocker = true)
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_CLASS)
public abstract class BaseIntegrationTest {

    // =========================================================================
    // Testcontainers
    // =========================================================================

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15");

    /**
     * Runs before the Spring context is created and wins over application*.properties.
     */
    @DynamicPropertySource
    static void configureTestContainerProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    // =========================================================================
    // Injected Spring beans
    // =========================================================================

    @LocalServerPort
    protected int port;

    @Autowired
    protected JdbcTemplate jdbcTemplate;

    @Autowired
    protected TestRestTemplate restTemplate;

    @Autowired
    protected ObjectMapper objectMapper;

    @Autowired
    private PlayerRepository playerRepository;

    @Autowired
    private PairRepository pairRepository;

    @Autowired
    private JwtUtil jwtUtil;

    private final List<StompSession> openSessions = new ArrayList<>();
    private int playerCounter;

    // =========================================================================
    // Per-test state reset
    // =========================================================================

    @BeforeEach
    void resetState() {
        jdbcTemplate.execute("TRUNCATE TABLE challenges, pairs, players RESTART IDENTITY CASCADE");
    }

    @AfterEach
    void closeWebSocketSessions() {
        for (StompSession session : openSessions) {
            try {
                if (session.isConnected()) {
                    session.disconnect();
                }
            } catch (Exception ignored) {
                // Best-effort cleanup
            }
        }
        openSessions.clear();
    }

    // =========================================================================
    // Seeding
    // =========================================================================

    /**
     * Two fresh players in a pair holding the given slot. The first player captains.
     */
    protected SeededPair seedPair(String groupLabel, Integer position) {
        int n = ++playerCounter;
        Player captain = playerRepository.save(new Player("Jugador", n + "a", "jugador" + n + "a@padelrank.test"));
        Player partner = playerRepository.save(new Player("Jugador", n + "b", "jugador" + n + "b@padelrank.test"));
        Pair pair = pairRepository.save(new Pair(captain.getId(), partner.getId(), captain.getId(), groupLabel, position));
        return new SeededPair(pair.getId(), captain.getId(), jwtUtil.generateAccessToken(captain.getId()),
                partner.getId(), jwtUtil.generateAccessToken(partner.getId()));
    }

    protected Pair reloadPair(Long pairId) {
        return pairRepository.findById(pairId).orElseThrow();
    }

    // =========================================================================
    // connectAsPlayer: STOMP session on the challenge-updates queue
    // =========================================================================

    protected PlayerSession connectAsPlayer(String token) throws Exception {
        BlockingQueue<Map<?, ?>> updates = new LinkedBlockingQueue<>();

        WebSocketStompClient stompClient = new WebSocketStompClient(new StandardWebSocketClient());
        stompClient.setMessageConverter(new MappingJackson2MessageConverter());

        String wsUrl = "ws://localhost:" + port + "/ws-padelrank?token=" + token;
        StompSession session = stompClient
                .connectAsync(wsUrl, new StompSessionHandlerAdapter() {})
                .get(5, TimeUnit.SECONDS);

        session.subscribe("/user/queue/challenge-updates", new JsonQueueHandler(updates));

        // Let the server register the SUBSCRIBE before the test acts
        Thread.sleep(100);

        openSessions.add(session);
        return new PlayerSession(token, session, updates);
    }

    // =========================================================================
    // HTTP helpers (4xx/5xx come back as responses, never as exceptions)
    // =========================================================================

    protected ResponseEntity<String> httpPost(String path, Object body, String token) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (token != null) {
            headers.setBearerAuth(token);
        }
        return restTemplate.exchange(path, HttpMethod.POST, new HttpEntity<>(body, headers), String.class);
    }

    protected ResponseEntity<String> httpGet(String path, String token) {
        HttpHeaders headers = new HttpHeaders();
        if (token != null) {
            headers.setBearerAuth(token);
        }
        return restTemplate.exchange(path, HttpMethod.GET, new HttpEntity<>(headers), String.class);
    }

    protected JsonNode json(ResponseEntity<String> response) throws Exception {
        return objectMapper.readTree(response.getBody());
    }

    // =========================================================================
    // Inner types
    // =========================================================================

    public record SeededPair(Long pairId, Long captainId, String captainToken,
                             Long partnerId, String partnerToken) {}

    public record PlayerSession(String token, StompSession stompSession, BlockingQueue<Map<?, ?>> updates) {}

    private record JsonQueueHandler(BlockingQueue<Map<?, ?>> queue) implements StompFrameHandler {

        @Override
        public Type getPayloadType(StompHeaders headers) {
            return Map.class;
        }

        @Override
        public void handleFrame(StompHeaders headers, Object payload) {
            if (payload instanceof Map<?, ?> message) {
                queue.offer(message);
            }
        }
    }
}
