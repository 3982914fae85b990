package uk.gegc.aianswers.features.answers;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import uk.gegc.aianswers.features.answers.application.AnswerRecordService;
import uk.gegc.aianswers.features.answers.domain.model.AnswerRecord;
import uk.gegc.aianswers.features.answers.infra.persistence.AnswerRecordDocumentRepository;
import uk.gegc.aianswers.features.auth.infra.security.IdTokenVerifier;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@TestPropertySource(properties = "app.answers.max-merge-attempts=200")
class AnswerRecordIntegrationTest {

    private static final String BASE = "/api/ai-answers";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private AnswerRecordService answerRecordService;

    @Autowired
    private AnswerRecordDocumentRepository repository;

    @MockitoBean
    private IdTokenVerifier idTokenVerifier;

    @BeforeEach
    void setUp() {
        when(idTokenVerifier.verify("token-u1")).thenReturn("u1");
        when(idTokenVerifier.verify("token-u2")).thenReturn("u2");
    }

    @AfterEach
    void cleanUp() {
        repository.deleteAll();
    }

    @Test
    @DisplayName("save, update, stats, delete round trip over HTTP")
    void fullLifecycle() throws Exception {
        mockMvc.perform(get(BASE).header(HttpHeaders.AUTHORIZATION, "Bearer token-u1"))
                .andExpect(status().isNotFound());

        mockMvc.perform(post(BASE)
                        .header(HttpHeaders.AUTHORIZATION, "Bearer token-u1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"answers\":{\"1\":\"I value honesty\",\"2\":\"Hiking\"}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total_questions").value(2));

        mockMvc.perform(put(BASE + "/1")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer token-u1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"answer\":\"Honesty and trust\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.answers['1']").value("Honesty and trust"))
                .andExpect(jsonPath("$.answers['2']").value("Hiking"))
                .andExpect(jsonPath("$.total_questions").value(2));

        mockMvc.perform(put(BASE + "/3")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer token-u1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"answer\":\"\"}"))
                .andExpect(status().isOk());

        mockMvc.perform(get(BASE + "/stats").header(HttpHeaders.AUTHORIZATION, "Bearer token-u1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total_questions").value(3))
                .andExpect(jsonPath("$.completed_questions").value(2))
                .andExpect(jsonPath("$.completion_percentage").value(66.67));

        mockMvc.perform(get(BASE).header(HttpHeaders.AUTHORIZATION, "Bearer token-u2"))
                .andExpect(status().isNotFound());

        mockMvc.perform(delete(BASE).header(HttpHeaders.AUTHORIZATION, "Bearer token-u1"))
                .andExpect(status().isOk());
        mockMvc.perform(delete(BASE).header(HttpHeaders.AUTHORIZATION, "Bearer token-u1"))
                .andExpect(status().isOk());

        mockMvc.perform(get(BASE + "/stats").header(HttpHeaders.AUTHORIZATION, "Bearer token-u1"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("an oversized answer is rejected with 400 and nothing is stored")
    void oversizedAnswerIsRejected() throws Exception {
        String body = "{\"answers\":{\"1\":\"" + "x".repeat(4_001) + "\"}}";

        mockMvc.perform(post(BASE)
                        .header(HttpHeaders.AUTHORIZATION, "Bearer token-u1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value("Answer must not exceed 4000 characters"))
                .andExpect(jsonPath("$.fieldErrors[0].field").value("answers.1"));

        assertThat(repository.findById("u1")).isEmpty();
    }

    @Test
    @DisplayName("health is public")
    void healthIsPublic() throws Exception {
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"));
    }

    @Test
    @DisplayName("concurrent single-answer updates against the database lose nothing")
    void concurrentUpdatesAgainstDatabase() throws Exception {
        answerRecordService.saveAnswers("u1", Map.of("seed", "x"));

        int writers = 4;
        int perWriter = 10;
        ExecutorService executor = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int w = 0; w < writers; w++) {
                int writer = w;
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < perWriter; i++) {
                        answerRecordService.updateSingleAnswer("u1", writer + "-" + i, "answer");
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(60, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        AnswerRecord record = answerRecordService.getAnswers("u1");
        assertThat(record.totalQuestions()).isEqualTo(writers * perWriter + 1);
        assertThat(repository.findById("u1")).hasValueSatisfying(row ->
                assertThat(row.getTotalQuestions()).isEqualTo(writers * perWriter + 1));
    }
}
