package it.aw.readingqueue.controller;

import it.aw.readingqueue.model.AnalysisParams;
import it.aw.readingqueue.model.AnalysisResult;
import it.aw.readingqueue.model.ClientStatus;
import it.aw.readingqueue.model.ClusterAssignment;
import it.aw.readingqueue.model.ClusterLabel;
import it.aw.readingqueue.model.ClusteringMethod;
import it.aw.readingqueue.model.ProjectionMethod;
import it.aw.readingqueue.service.GraphService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Set;

/**
 * Vista a grafo: layout 2D + cluster, ed etichette dei cluster.
 *
 *   POST /api/graph/analyze — proiezione e clustering degli item filtrati
 *   POST /api/graph/labels  — etichette per le assegnazioni ricevute (PENDING se non pronte)
 *
 * Le etichette sono una chiamata separata: arrivano dopo il layout, che resta utilizzabile subito.
 */
@RestController
@RequestMapping("/api/graph")
public class GraphController {

    private final GraphService graphService;

    public GraphController(GraphService graphService) {
        this.graphService = graphService;
    }

    public record AnalyzeRequest(
            Set<ClientStatus> statuses,
            ProjectionMethod projection,
            ClusteringMethod clustering,
            AnalysisParams params) {}

    public record LabelRequest(List<ClusterAssignment> assignments) {}

    /**
     * Esempio:
     *   curl -X POST http://localhost:8889/api/graph/analyze -H "X-User-Id: u1" \
     *        -H "Content-Type: application/json" \
     *        -d '{"statuses":["QUEUED"],"projection":"UMAP","clustering":"KMEANS","params":{"clusterCount":4}}'
     */
    @PostMapping("/analyze")
    public ResponseEntity<AnalysisResult> analyze(@RequestHeader(ItemController.USER_HEADER) String userId,
                                                  @RequestBody AnalyzeRequest request) {
        ProjectionMethod projection = request.projection() != null ? request.projection() : ProjectionMethod.PCA;
        ClusteringMethod clustering = request.clustering() != null ? request.clustering() : ClusteringMethod.KMEANS;
        return ResponseEntity.ok(graphService.analyze(userId, request.statuses(), projection, clustering,
                request.params()));
    }

    @PostMapping("/labels")
    public ResponseEntity<List<ClusterLabel>> labels(@RequestHeader(ItemController.USER_HEADER) String userId,
                                                     @RequestBody LabelRequest request) {
        List<ClusterAssignment> assignments = request.assignments() != null ? request.assignments() : List.of();
        return ResponseEntity.ok(graphService.labels(userId, assignments));
    }
}
