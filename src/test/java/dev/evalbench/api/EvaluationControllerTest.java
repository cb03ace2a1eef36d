package dev.evalbench.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import dev.evalbench.dataset.DatasetValidator;
import dev.evalbench.dataset.ParsedDataset;
import dev.evalbench.evaluation.ExportFormat;
import dev.evalbench.session.EvaluationOrchestrator;
import dev.evalbench.session.EvaluationSession;
import dev.evalbench.session.SessionState;
import dev.evalbench.session.StartRequest;
import dev.evalbench.stream.InMemoryPushEventChannel;
import dev.evalbench.stream.PushMessage;
import dev.evalbench.stream.PushMessageType;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;

@ExtendWith(MockitoExtension.class)
class EvaluationControllerTest {

    private static final Clock FIXED_CLOCK =
            Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneId.of("UTC"));

    @Mock private EvaluationOrchestrator orchestrator;

    private InMemoryPushEventChannel channel;
    private EvaluationController controller;

    @BeforeEach
    void setUp() {
        channel = new InMemoryPushEventChannel();
        controller = new EvaluationController(orchestrator, channel, FIXED_CLOCK);
    }

    @Test
    void uploadValidDatasetReturns200() {
        ParsedDataset dataset = DatasetValidator.parse("question\nWhy?");
        when(orchestrator.selectDataset("question\nWhy?")).thenReturn(dataset);

        ResponseEntity<ParsedDataset> response = controller.uploadDataset("question\nWhy?");

        assertThat(response.getStatusCode().value()).isEqualTo(200);
        assertThat(response.getBody()).isSameAs(dataset);
    }

    @Test
    void uploadInvalidDatasetReturns422WithEveryError() {
        ParsedDataset dataset = DatasetValidator.parse("prompt\nhello");
        when(orchestrator.selectDataset("prompt\nhello")).thenReturn(dataset);

        ResponseEntity<ParsedDataset> response = controller.uploadDataset("prompt\nhello");

        assertThat(response.getStatusCode().value()).isEqualTo(422);
        assertThat(response.getBody().errors()).isEqualTo(dataset.errors());
    }

    @Test
    void removeDatasetReturns204() {
        ResponseEntity<Void> response = controller.removeDataset();

        assertThat(response.getStatusCode().value()).isEqualTo(204);
        verify(orchestrator).removeDataset();
    }

    @Test
    void sampleDatasetIsServedAsCsvAttachment() {
        ResponseEntity<String> response = controller.sampleDataset();

        assertThat(response.getHeaders().getFirst(HttpHeaders.CONTENT_DISPOSITION))
                .contains("sample-questions.csv");
        assertThat(response.getBody()).startsWith("\"question\"");
    }

    @Test
    void startForwardsRequestAndReturns202() {
        when(orchestrator.start(any(StartRequest.class))).thenReturn(new CompletableFuture<>());
        when(orchestrator.snapshot()).thenReturn(SessionState.initial(50));
        when(orchestrator.selectedDataset()).thenReturn(Optional.empty());

        ResponseEntity<SessionView> response = controller.start(
                new StartEvaluationRequest("tutor", "Math Tutor", null, Map.of("locale", "en"), 3));

        assertThat(response.getStatusCode().value()).isEqualTo(202);
        ArgumentCaptor<StartRequest> captor = ArgumentCaptor.forClass(StartRequest.class);
        verify(orchestrator).start(captor.capture());
        assertThat(captor.getValue().agentCode()).isEqualTo("tutor");
        assertThat(captor.getValue().batchSize()).isEqualTo(3);
    }

    @Test
    void getReturnsSessionStatsResultsAndLogs() {
        when(orchestrator.snapshot()).thenReturn(SessionState.initial(50));
        when(orchestrator.selectedDataset()).thenReturn(Optional.empty());

        SessionView view = controller.get();

        assertThat(view.session()).isEqualTo(EvaluationSession.idle());
        assertThat(view.stats().total()).isZero();
        assertThat(view.results()).isEmpty();
        assertThat(view.logs()).isEmpty();
        assertThat(view.dataset()).isNull();
    }

    @Test
    void exportSetsContentTypeAndFilename() throws Exception {
        when(orchestrator.exportReport(ExportFormat.JSON)).thenReturn("{}".getBytes(StandardCharsets.UTF_8));
        when(orchestrator.exportFileName(ExportFormat.JSON)).thenReturn("bulk-evaluation-results-x-session.json");

        ResponseEntity<byte[]> response = controller.export("json");

        assertThat(response.getHeaders().getContentType().toString()).isEqualTo("application/json");
        assertThat(response.getHeaders().getFirst(HttpHeaders.CONTENT_DISPOSITION))
                .contains("bulk-evaluation-results-x-session.json");
    }

    @Test
    void exportWithUnknownFormatIsRejected() {
        assertThatThrownBy(() -> controller.export("xml")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void eventsArePublishedToTheChannel() {
        List<PushMessage> received = new ArrayList<>();
        channel.subscribe("run-1", received::add);
        PushMessage message = PushMessage.of(PushMessageType.LOG, "run-1",
                JsonNodeFactory.instance.textNode("hello"), Instant.parse("2026-03-01T09:59:00Z"));

        ResponseEntity<Map<String, Integer>> response = controller.publish(message);

        assertThat(response.getStatusCode().value()).isEqualTo(202);
        assertThat(response.getBody()).containsEntry("delivered", 1);
        assertThat(received).containsExactly(message);
    }

    @Test
    void eventsWithoutTimestampAreStampedFromTheClock() {
        List<PushMessage> received = new ArrayList<>();
        channel.subscribe("run-1", received::add);

        controller.publish(new PushMessage(PushMessageType.LOG, "run-1",
                JsonNodeFactory.instance.textNode("hello"), null));

        assertThat(received).singleElement()
                .extracting(PushMessage::ts)
                .isEqualTo(FIXED_CLOCK.instant());
    }

    @Test
    void pauseResumeCancelClearDelegate() {
        EvaluationSession idle = EvaluationSession.idle();
        when(orchestrator.pause()).thenReturn(idle);
        when(orchestrator.resume()).thenReturn(idle);
        when(orchestrator.cancel()).thenReturn(idle);
        when(orchestrator.clear()).thenReturn(idle);

        assertThat(controller.pause()).isSameAs(idle);
        assertThat(controller.resume()).isSameAs(idle);
        assertThat(controller.cancel()).isSameAs(idle);
        assertThat(controller.clear()).isSameAs(idle);
    }
}
