package com.shardrouter.adapter.in.web;

import com.shardrouter.application.port.in.DecideConnectionUseCase;
import com.shardrouter.application.port.in.DescribeTopologyUseCase;
import com.shardrouter.application.port.in.DescribeTopologyUseCase.Topology;
import com.shardrouter.domain.error.ValidationError;
import com.shardrouter.domain.model.ModelId;
import com.shardrouter.domain.model.ModelRoutingPolicy;
import com.shardrouter.domain.model.OperationKind;
import com.shardrouter.domain.model.RecordContext;
import com.shardrouter.domain.model.RoutingDecision;
import com.shardrouter.domain.model.ShardConnections;
import com.shardrouter.domain.model.ShardKey;
import com.shardrouter.infrastructure.filter.RoutingContextFilter;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.MDC;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/routing")
@Tag(name = "Routing", description = "Inspect the topology and dry-run routing decisions")
public class RoutingAdminController {

    private final DescribeTopologyUseCase describeTopologyUseCase;
    private final DecideConnectionUseCase decideConnectionUseCase;

    public RoutingAdminController(
            DescribeTopologyUseCase describeTopologyUseCase,
            DecideConnectionUseCase decideConnectionUseCase) {
        this.describeTopologyUseCase = describeTopologyUseCase;
        this.decideConnectionUseCase = decideConnectionUseCase;
    }

    @GetMapping("/topology")
    @Operation(summary = "Get topology", description = "Lists shards with their connections and the registered model policies")
    public ResponseEntity<TopologyResponse> topology() {
        return ResponseEntity.ok(TopologyResponse.from(describeTopologyUseCase.describeTopology()));
    }

    @GetMapping("/decisions")
    @Operation(summary = "Dry-run a routing decision",
        description = "Returns the connection an operation on the model would use under the request's routing context")
    public ResponseEntity<?> decide(
            @Parameter(description = "Model id", example = "accounts")
            @RequestParam String model,
            @Parameter(description = "read, write, force_replica or force_primary", example = "read")
            @RequestParam(defaultValue = "read") String operation,
            @Parameter(description = "Shard to select for sharded models", example = "shard_0")
            @RequestParam(required = false) String shard) {

        var modelResult = ModelId.parse(model);
        if (modelResult.isFailure()) {
            return toValidationErrorResponse(modelResult.errorOrNull());
        }

        var operationResult = OperationKind.parse(operation);
        if (operationResult.isFailure()) {
            return toValidationErrorResponse(operationResult.errorOrNull());
        }

        RecordContext record = RecordContext.empty();
        if (shard != null) {
            var shardResult = ShardKey.parse(shard);
            if (shardResult.isFailure()) {
                return toValidationErrorResponse(shardResult.errorOrNull());
            }
            record = RecordContext.selecting(shardResult.getOrThrow());
        }

        RoutingDecision decision = decideConnectionUseCase.explain(
            modelResult.getOrThrow(),
            operationResult.getOrThrow(),
            record
        );
        return ResponseEntity.ok(DecisionResponse.from(decision));
    }

    private ResponseEntity<ErrorResponse> toValidationErrorResponse(ValidationError error) {
        return ResponseEntity.badRequest()
            .body(new ErrorResponse(error.code(), error.message(), MDC.get(RoutingContextFilter.REQUEST_ID_MDC_KEY)));
    }

    public record ErrorResponse(String error, String message, String requestId) {}

    public record TopologyResponse(
        String defaultShard,
        List<ShardResponse> shards,
        List<ModelResponse> models
    ) {
        public static TopologyResponse from(Topology topology) {
            List<ShardResponse> shards = topology.shards().entrySet().stream()
                .map(entry -> ShardResponse.from(entry.getKey(), entry.getValue()))
                .toList();
            List<ModelResponse> models = topology.models().stream()
                .map(ModelResponse::from)
                .toList();
            return new TopologyResponse(topology.defaultShard().value(), shards, models);
        }
    }

    public record ShardResponse(String key, String primary, String replica) {
        public static ShardResponse from(ShardKey key, ShardConnections connections) {
            return new ShardResponse(
                key.value(),
                connections.primary().describe(),
                connections.hasDedicatedReplica() ? connections.replica().describe() : null
            );
        }
    }

    public record ModelResponse(String model, boolean sharded, boolean replicaByDefault) {
        public static ModelResponse from(ModelRoutingPolicy policy) {
            return new ModelResponse(policy.modelId().value(), policy.sharded(), policy.onReplicaByDefault());
        }
    }

    public record DecisionResponse(
        String model,
        String operation,
        String role,
        String shard,
        String connection,
        String reason
    ) {
        public static DecisionResponse from(RoutingDecision decision) {
            return new DecisionResponse(
                decision.modelId().value(),
                decision.operation().label(),
                decision.role().label(),
                decision.shardKey().value(),
                decision.handle().describe(),
                decision.reason().label()
            );
        }
    }
}
