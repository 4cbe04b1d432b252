package com.example.media_analyzer.controller;

import com.example.media_analyzer.dto.web.AnalysisResultResponse;
import com.example.media_analyzer.dto.web.JobStatusResponse;
import com.example.media_analyzer.dto.web.JobSummaryResponse;
import com.example.media_analyzer.dto.web.PageResponse;
import com.example.media_analyzer.service.PipelineJobService;
import com.example.media_analyzer.service.UploadService;
import com.example.media_analyzer.util.AnalysisMode;
import com.example.media_analyzer.util.PipelineStage;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Size;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

import java.util.Locale;
import java.util.UUID;

@RestController
@RequestMapping("/v1/analyses")
public class AnalysisController {

    private final PipelineJobService jobService;
    private final UploadService uploadService;

    public AnalysisController(PipelineJobService jobService, UploadService uploadService) {
        this.jobService = jobService;
        this.uploadService = uploadService;
    }

    @Operation(summary = "Queue an analysis for media already in raw storage")
    @ApiResponse(responseCode = "202", description = "Job queued")
    @ApiResponse(responseCode = "400", description = "Missing, unknown or unsupported media")
    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<SubmitResponse> submit(@Valid @RequestBody SubmitRequest req) {
        if (req == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "MEDIA_PATH_REQUIRED");
        }
        UUID jobId = jobService.submit(req.mediaPath(), req.context(), req.analysisMode());
        return ResponseEntity.accepted().body(new SubmitResponse(jobId, PipelineStage.QUEUED));
    }

    @Operation(summary = "Upload a video or audio file and queue its analysis")
    @ApiResponse(responseCode = "202", description = "File stored and job queued")
    @ApiResponse(responseCode = "400", description = "Empty file, bad name, unsupported format or mode")
    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<SubmitResponse> upload(@RequestPart("file") MultipartFile file,
                                                 @RequestParam(value = "context", required = false) String context,
                                                 @RequestParam(value = "analysisMode", required = false) String analysisMode) {
        AnalysisMode mode;
        try {
            mode = AnalysisMode.fromJson(analysisMode);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "UNSUPPORTED_ANALYSIS_MODE", e);
        }
        UUID jobId = uploadService.uploadAndSubmit(file, context, mode);
        return ResponseEntity.accepted().body(new SubmitResponse(jobId, PipelineStage.QUEUED));
    }

    @Operation(summary = "List analyses, newest first")
    @ApiResponse(responseCode = "400", description = "Unknown stage or invalid paging")
    @GetMapping
    public PageResponse<JobSummaryResponse> list(@RequestParam(value = "stage", required = false) String stage,
                                                 @RequestParam(value = "page", defaultValue = "0") int page,
                                                 @RequestParam(value = "size", defaultValue = "20") int size) {
        return jobService.list(parseStage(stage), page, size);
    }

    @GetMapping("/{id}")
    public JobStatusResponse status(@PathVariable UUID id) {
        return jobService.getStatus(id);
    }

    @Operation(summary = "Re-run a failed job from scratch")
    @ApiResponse(responseCode = "409", description = "Job is not failed or still winding down")
    @PostMapping("/{id}/retry")
    public ResponseEntity<SubmitResponse> retry(@PathVariable UUID id) {
        jobService.retry(id);
        return ResponseEntity.accepted().body(new SubmitResponse(id, PipelineStage.QUEUED));
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<Void> cancel(@PathVariable UUID id) {
        jobService.cancel(id);
        return ResponseEntity.accepted().build();
    }

    @GetMapping("/{id}/result")
    public AnalysisResultResponse result(@PathVariable UUID id) {
        return jobService.getResult(id);
    }

    @Operation(summary = "Delete a finished analysis with its frames and uploaded media")
    @ApiResponse(responseCode = "204", description = "Deleted")
    @ApiResponse(responseCode = "409", description = "Job not finished or still winding down")
    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable UUID id) {
        jobService.delete(id);
        return ResponseEntity.noContent().build();
    }

    private static PipelineStage parseStage(String stage) {
        if (stage == null || stage.isBlank()) {
            return null;
        }
        try {
            return PipelineStage.valueOf(stage.strip().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "UNSUPPORTED_STAGE", e);
        }
    }

    public record SubmitRequest(@Size(max = 1024) String mediaPath,
                                @Size(max = 20000) String context,
                                AnalysisMode analysisMode) {}

    public record SubmitResponse(UUID jobId, PipelineStage stage) {}
}
