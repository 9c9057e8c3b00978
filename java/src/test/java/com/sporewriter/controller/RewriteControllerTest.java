package com.sporewriter.controller;

import com.sporewriter.exception.GlobalExceptionHandler;
import com.sporewriter.rewrite.MorphismValidator;
import com.sporewriter.rewrite.RewriteEngine;
import com.sporewriter.service.RewriteService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Integration tests for RewriteController.
 */
@WebFluxTest(controllers = RewriteController.class)
@Import({RewriteService.class, MorphismValidator.class, RewriteEngine.class, GlobalExceptionHandler.class})
class RewriteControllerTest {

    @Autowired
    private WebTestClient webTestClient;

    private WebTestClient.ResponseSpec post(String body) {
        return webTestClient.post()
                .uri("/calculate")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .exchange();
    }

    @Test
    void calculate_PureDeletion() {
        String body = """
                {
                  "mapping_lhs_to_input": {"10": 2},
                  "mapping_rhs_to_lhs": {},
                  "graph_input": {
                    "graph": {"title": "path"},
                    "nodes": [{"id": 1}, {"id": 2}, {"id": 3}],
                    "links": [{"source": 1, "target": 2}, {"source": 2, "target": 3}]
                  },
                  "graph_lhs": {"nodes": [{"id": 10}], "links": []},
                  "graph_rhs": {"nodes": [], "links": []}
                }
                """;

        post(body)
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.directed").isEqualTo(false)
                .jsonPath("$.graph.title").isEqualTo("path")
                .jsonPath("$.nodes.length()").isEqualTo(2)
                .jsonPath("$.nodes[0].id").isEqualTo(1)
                .jsonPath("$.nodes[1].id").isEqualTo(3)
                .jsonPath("$.links.length()").isEqualTo(0);
    }

    @Test
    void calculate_PureAdditionWithStringIds() {
        String body = """
                {
                  "mapping_lhs_to_input": {"10": "1"},
                  "mapping_rhs_to_lhs": {"10": 10},
                  "graph_input": {"nodes": [{"id": 1, "x": 0.0, "y": 0.0}], "links": []},
                  "graph_lhs": {"nodes": [{"id": "10"}], "links": []},
                  "graph_rhs": {
                    "nodes": [{"id": 10}, {"id": 11, "x": 5.0, "y": 0.0}],
                    "links": [{"source": 10, "target": 11}]
                  }
                }
                """;

        post(body)
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.nodes.length()").isEqualTo(2)
                .jsonPath("$.nodes[1].id").isEqualTo(2)
                .jsonPath("$.nodes[1].x").isEqualTo(5.0)
                .jsonPath("$.nodes[1].y").isEqualTo(0.0)
                .jsonPath("$.links[0].source").isEqualTo(1)
                .jsonPath("$.links[0].target").isEqualTo(2);
    }

    @Test
    void calculate_NoMorphismIsBadRequest() {
        String body = """
                {
                  "mapping_lhs_to_input": {"a": 1, "b": 2},
                  "graph_input": {"nodes": [{"id": 1}, {"id": 2}], "links": []},
                  "graph_lhs": {
                    "nodes": [{"id": "a"}, {"id": "b"}],
                    "links": [{"source": "a", "target": "b"}]
                  },
                  "graph_rhs": {"nodes": [], "links": []}
                }
                """;

        post(body)
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.detail").value(detail -> assertTrue(
                        detail.toString().startsWith("error: no morphism")))
                .jsonPath("$.traceId").exists();
    }

    @Test
    void calculate_UnmappedPatternNodeIsBadRequest() {
        String body = """
                {
                  "mapping_lhs_to_input": {},
                  "graph_input": {"nodes": [{"id": 1}], "links": []},
                  "graph_lhs": {"nodes": [{"id": "a"}], "links": []},
                  "graph_rhs": {"nodes": [], "links": []}
                }
                """;

        post(body)
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.detail").isEqualTo("error: lhs isn't fully mapped to input");
    }

    @Test
    void calculate_DanglingLinkIsBadRequest() {
        String body = """
                {
                  "graph_input": {"nodes": [{"id": 1}], "links": [{"source": 1, "target": 9}]},
                  "graph_lhs": {"nodes": [], "links": []},
                  "graph_rhs": {"nodes": [], "links": []}
                }
                """;

        post(body)
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.detail").value(detail -> assertTrue(
                        detail.toString().contains("references a missing node")));
    }

    @Test
    void calculate_MissingGraphFailsValidation() {
        String body = """
                {
                  "graph_input": {"nodes": [], "links": []},
                  "graph_lhs": {"nodes": [], "links": []}
                }
                """;

        post(body)
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.detail").value(detail -> assertTrue(
                        detail.toString().contains("graphRhs")));
    }
}
