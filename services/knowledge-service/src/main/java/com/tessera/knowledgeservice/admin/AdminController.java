package com.tessera.knowledgeservice.admin;

import com.tessera.pipeline.execution.FailureLedger;
import com.tessera.pipeline.execution.TerminalFailure;
import com.tessera.pipeline.projection.ProjectionMaterializer;
import com.tessera.pipeline.projection.RebuildReport;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Operator endpoints: projection rebuilds and the terminal failure ledger. */
@RestController
@RequestMapping("/api/v1/admin")
public class AdminController {

    private static final Logger log = LoggerFactory.getLogger(AdminController.class);

    private final ProjectionMaterializer materializer;
    private final FailureLedger failures;

    public AdminController(ProjectionMaterializer materializer, FailureLedger failures) {
        this.materializer = materializer;
        this.failures = failures;
    }

    /**
     * Replays completed events into the projections.
     *
     * @param from ISO-8601 instant; every event when absent
     */
    @PostMapping("/projections/rebuild")
    public RebuildReport rebuild(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME)
                    Instant from) {
        RebuildReport report = materializer.rebuild(Optional.ofNullable(from));
        log.info(
                "Projection rebuild requested: {} processed, {} projected, {} errors",
                report.processed(),
                report.projected(),
                report.errors());
        return report;
    }

    @GetMapping("/failures")
    public List<TerminalFailure> failures() {
        return failures.all();
    }
}
