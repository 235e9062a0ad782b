package com.example.doccompare.web;

import com.example.doccompare.alignment.SentenceAligner;
import com.example.doccompare.application.BatchComparisonService;
import com.example.doccompare.application.ComparisonResultPersistenceService;
import com.example.doccompare.application.DocumentPairing;
import com.example.doccompare.application.MarkupRenderer;
import com.example.doccompare.domain.ComparisonSummary;
import com.example.doccompare.domain.DocumentExtractionException;
import com.example.doccompare.domain.DocumentInput;
import com.example.doccompare.domain.InvalidConfigurationException;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

@Controller
public class HomeController {
    private final MultipartDocumentInputAdapter documentInputAdapter;
    private final DocumentPairing documentPairing;
    private final BatchComparisonService batchComparisonService;
    private final ComparisonResultPersistenceService comparisonResultPersistenceService;
    private final MarkupRenderer markupRenderer;
    private final double defaultThreshold;

    public HomeController(
            MultipartDocumentInputAdapter documentInputAdapter,
            DocumentPairing documentPairing,
            BatchComparisonService batchComparisonService,
            ComparisonResultPersistenceService comparisonResultPersistenceService,
            MarkupRenderer markupRenderer,
            @Value("${compare.match-threshold:0.3}") double defaultThreshold) {
        SentenceAligner.validateThreshold(defaultThreshold);
        this.documentInputAdapter = documentInputAdapter;
        this.documentPairing = documentPairing;
        this.batchComparisonService = batchComparisonService;
        this.comparisonResultPersistenceService = comparisonResultPersistenceService;
        this.markupRenderer = markupRenderer;
        this.defaultThreshold = defaultThreshold;
    }

    @GetMapping("/")
    public String index(
            @RequestParam(name = "name", required = false) String nameFilter,
            @RequestParam(name = "ip", required = false) String ipFilter,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size,
            Model model) {
        var comparisonPage =
                comparisonResultPersistenceService.searchComparisons(
                        nameFilter, ipFilter, page, size);
        model.addAttribute("recentComparisons", comparisonPage.getContent());
        model.addAttribute("comparisonPage", comparisonPage);
        model.addAttribute("nameFilter", nameFilter == null ? "" : nameFilter);
        model.addAttribute("ipFilter", ipFilter == null ? "" : ipFilter);
        model.addAttribute("defaultThreshold", defaultThreshold);
        return "index";
    }

    @PostMapping("/compare")
    public String compare(
            @RequestParam("leftFiles") MultipartFile[] leftFiles,
            @RequestParam("rightFiles") MultipartFile[] rightFiles,
            @RequestParam(name = "threshold", required = false) Double threshold,
            HttpServletRequest httpRequest,
            Model model) {
        double effectiveThreshold = threshold != null ? threshold : defaultThreshold;
        try {
            List<DocumentInput> left = documentInputAdapter.adapt(leftFiles);
            List<DocumentInput> right = documentInputAdapter.adapt(rightFiles);
            DocumentPairing.PairingResult pairing = documentPairing.pair(left, right);

            List<ComparisonLink> links = new ArrayList<>();
            for (BatchComparisonService.PairComparison comparison :
                    batchComparisonService.compareAll(pairing.pairs(), effectiveThreshold)) {
                long id =
                        comparisonResultPersistenceService.saveComparison(
                                comparison.key(), httpRequest.getRemoteAddr(), comparison.result());
                links.add(new ComparisonLink(id, comparison.key(), comparison.result().getSummary()));
            }
            model.addAttribute("results", links);
            model.addAttribute("unpairedLeft", pairing.unpairedLeft());
            model.addAttribute("unpairedRight", pairing.unpairedRight());
            model.addAttribute("threshold", effectiveThreshold);
            return "results";
        } catch (InvalidConfigurationException | IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        } catch (DocumentExtractionException e) {
            throw new ResponseStatusException(HttpStatus.UNPROCESSABLE_ENTITY, e.getMessage(), e);
        } catch (IOException e) {
            throw new ResponseStatusException(
                    HttpStatus.INTERNAL_SERVER_ERROR, "Failed to compare documents", e);
        }
    }

    @GetMapping("/compare/{id}")
    public String viewComparison(
            @PathVariable("id") long id, Model model, HttpServletRequest request) {
        var storedResult = comparisonResultPersistenceService.loadComparison(id);
        model.addAttribute("message", storedResult.name());
        model.addAttribute("result", storedResult.result());
        model.addAttribute("comparisonId", storedResult.id());
        model.addAttribute("ipRequest", storedResult.ipRequest());
        model.addAttribute("created", storedResult.created());
        model.addAttribute(
                "canDelete", storedResult.ipRequest() != null
                        && storedResult.ipRequest().equals(request.getRemoteAddr()));
        return "diff";
    }

    @GetMapping("/compare/{id}/export")
    public ResponseEntity<String> exportComparison(@PathVariable("id") long id) {
        var storedResult = comparisonResultPersistenceService.loadComparison(id);
        String page = markupRenderer.renderPage(storedResult.name(), storedResult.result().getRows());
        ContentDisposition disposition =
                ContentDisposition.attachment()
                        .filename(storedResult.name() + "_compare.html", StandardCharsets.UTF_8)
                        .build();
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, disposition.toString())
                .contentType(new MediaType(MediaType.TEXT_HTML, StandardCharsets.UTF_8))
                .body(page);
    }

    @PostMapping("/compare/{id}/delete")
    public String deleteComparison(@PathVariable("id") long id, HttpServletRequest request) {
        comparisonResultPersistenceService.deleteComparison(id, request.getRemoteAddr());
        return "redirect:/";
    }

    public record ComparisonLink(long id, String name, ComparisonSummary summary) {}
}
