package it.unimib.datai.lambdagateway.gateway.api;

import it.unimib.datai.lambdagateway.gateway.deploy.DeploymentCache;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Comparator;
import java.util.List;

/**
 * Lists the functions published at startup.
 */
@RestController
@RequestMapping("/admin")
@ConditionalOnProperty(name = "lambdagateway.admin.deployments.enabled", havingValue = "true")
public class DeploymentController {
    private final DeploymentCache deploymentCache;

    public DeploymentController(DeploymentCache deploymentCache) {
        this.deploymentCache = deploymentCache;
    }

    @GetMapping("/deployments")
    public List<DeploymentView> list() {
        return deploymentCache.entries().entrySet().stream()
                .map(entry -> new DeploymentView(
                        entry.getKey().method(),
                        entry.getKey().path(),
                        entry.getValue().functionName()))
                .sorted(Comparator.comparing(DeploymentView::path).thenComparing(DeploymentView::method))
                .toList();
    }

    public record DeploymentView(String method, String path, String functionName) {
    }
}
