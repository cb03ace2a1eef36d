package dev.evalbench.api;

import dev.evalbench.dataset.ParsedDataset;
import dev.evalbench.dataset.SampleDataset;
import dev.evalbench.evaluation.ExportFormat;
import dev.evalbench.session.EvaluationOrchestrator;
import dev.evalbench.session.EvaluationSession;
import dev.evalbench.stream.InMemoryPushEventChannel;
import dev.evalbench.stream.PushMessage;
import jakarta.validation.Valid;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Map;

import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/evaluations")
public class EvaluationController {

    private final EvaluationOrchestrator orchestrator;
    private final InMemoryPushEventChannel channel;
    private final Clock clock;

    public EvaluationController(EvaluationOrchestrator orchestrator,
                                InMemoryPushEventChannel channel,
                                Clock clock) {
        this.orchestrator = orchestrator;
        this.channel = channel;
        this.clock = clock;
    }

    @PostMapping(value = "/dataset", consumes = {MediaType.TEXT_PLAIN_VALUE, "text/csv"})
    public ResponseEntity<ParsedDataset> uploadDataset(@RequestBody(required = false) String csv) {
        ParsedDataset dataset = orchestrator.selectDataset(csv);
        return dataset.isValid()
                ? ResponseEntity.ok(dataset)
                : ResponseEntity.unprocessableEntity().body(dataset);
    }

    @DeleteMapping("/dataset")
    public ResponseEntity<Void> removeDataset() {
        orchestrator.removeDataset();
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/dataset/sample")
    public ResponseEntity<String> sampleDataset() {
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename(SampleDataset.FILE_NAME).build().toString())
                .contentType(MediaType.parseMediaType("text/csv"))
                .body(SampleDataset.csv());
    }

    @PostMapping("/start")
    public ResponseEntity<SessionView> start(@Valid @RequestBody StartEvaluationRequest req) {
        orchestrator.start(req.toStartRequest());
        return ResponseEntity.accepted().body(view());
    }

    @PostMapping("/pause")
    public EvaluationSession pause() {
        return orchestrator.pause();
    }

    @PostMapping("/resume")
    public EvaluationSession resume() {
        return orchestrator.resume();
    }

    @PostMapping("/cancel")
    public EvaluationSession cancel() {
        return orchestrator.cancel();
    }

    @PostMapping("/clear")
    public EvaluationSession clear() {
        return orchestrator.clear();
    }

    @GetMapping
    public SessionView get() {
        return view();
    }

    @GetMapping("/export")
    public ResponseEntity<byte[]> export(@RequestParam(defaultValue = "csv") String format) throws IOException {
        ExportFormat exportFormat = ExportFormat.fromName(format);
        byte[] report = orchestrator.exportReport(exportFormat);
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment()
                        .filename(orchestrator.exportFileName(exportFormat)).build().toString())
                .contentType(MediaType.parseMediaType(exportFormat.mediaType()))
                .body(report);
    }

    @PostMapping("/export")
    public Map<String, String> exportToFile(@RequestParam(defaultValue = "csv") String format) throws IOException {
        Path path = orchestrator.exportToFile(ExportFormat.fromName(format));
        return Map.of("path", path.toString());
    }

    /** Push ingress: transports post evaluation-service messages here. */
    @PostMapping("/events")
    public ResponseEntity<Map<String, Integer>> publish(@RequestBody PushMessage message) {
        int delivered = channel.publish(message.stampedIfMissing(clock.instant()));
        return ResponseEntity.accepted().body(Map.of("delivered", delivered));
    }

    private SessionView view() {
        return SessionView.of(orchestrator.snapshot(),
                orchestrator.selectedDataset().orElse(null), clock.instant());
    }
}
