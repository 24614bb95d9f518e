package it.unimib.datai.lambdagateway.gateway.api;

import it.unimib.datai.lambdagateway.common.platform.FunctionHandle;
import it.unimib.datai.lambdagateway.gateway.deploy.DeploymentCache;
import it.unimib.datai.lambdagateway.gateway.route.RouteId;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.util.Map;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@WebFluxTest(controllers = DeploymentController.class, properties = "lambdagateway.admin.deployments.enabled=true")
class DeploymentControllerTest {

    @Autowired
    private WebTestClient webClient;

    @MockitoBean
    private DeploymentCache deploymentCache;

    @Test
    void list_returnsDeployedFunctionsSortedByPath() {
        FunctionHandle orders = handle("orders-fn");
        FunctionHandle hello = handle("hello-fn");
        when(deploymentCache.entries()).thenReturn(Map.of(
                RouteId.of("POST", "/orders"), orders,
                RouteId.of("GET", "/hello"), hello));

        webClient.get()
                .uri("/admin/deployments")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(2)
                .jsonPath("$[0].path").isEqualTo("/hello")
                .jsonPath("$[0].method").isEqualTo("GET")
                .jsonPath("$[0].functionName").isEqualTo("hello-fn")
                .jsonPath("$[1].functionName").isEqualTo("orders-fn");
    }

    @Test
    void list_emptyWhenNothingWasDeployed() {
        when(deploymentCache.entries()).thenReturn(Map.of());

        webClient.get()
                .uri("/admin/deployments")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .json("[]");
    }

    private static FunctionHandle handle(String name) {
        FunctionHandle handle = mock(FunctionHandle.class);
        when(handle.functionName()).thenReturn(name);
        return handle;
    }
}
