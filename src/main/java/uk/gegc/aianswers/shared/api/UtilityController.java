package uk.gegc.aianswers.shared.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.HealthEndpoint;
import org.springframework.boot.actuate.health.Status;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@Tag(name = "Utility", description = "Liveness for load balancers and uptime checks")
@RequiredArgsConstructor
public class UtilityController {

    private final HealthEndpoint healthEndpoint;
    private final Clock clock;

    @Operation(
            summary = "Health-check endpoint",
            description = "Aggregated Actuator health plus the server time. No authentication required."
    )
    @ApiResponse(responseCode = "200", description = "Service is up")
    @ApiResponse(responseCode = "503", description = "A health contributor (e.g. the database) is down")
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Status status = healthEndpoint.health().getStatus();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", status.getCode());
        body.put("timestamp", clock.instant());
        HttpStatus httpStatus = Status.UP.equals(status) ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(httpStatus).body(body);
    }
}
