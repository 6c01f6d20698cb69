package com.example.pdp.exception;

import com.example.pdp.common.util.StringSanitizer;
import com.example.pdp.datafilter.DataFilterException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.web.WebProperties;
import org.springframework.boot.autoconfigure.web.reactive.error.AbstractErrorWebExceptionHandler;
import org.springframework.boot.web.error.ErrorAttributeOptions;
import org.springframework.boot.web.reactive.error.ErrorAttributes;
import org.springframework.context.ApplicationContext;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerCodecConfigurer;
import org.springframework.stereotype.Component;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.server.RequestPredicates;
import org.springframework.web.reactive.function.server.RouterFunction;
import org.springframework.web.reactive.function.server.RouterFunctions;
import org.springframework.web.reactive.function.server.ServerRequest;
import org.springframework.web.reactive.function.server.ServerResponse;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@Component
@Order(-2)  // Higher priority than DefaultErrorWebExceptionHandler
public class GlobalErrorWebExceptionHandler extends AbstractErrorWebExceptionHandler {

    public GlobalErrorWebExceptionHandler(
            ErrorAttributes errorAttributes,
            WebProperties webProperties,
            ApplicationContext applicationContext,
            ServerCodecConfigurer serverCodecConfigurer) {
        super(errorAttributes, webProperties.getResources(), applicationContext);
        this.setMessageWriters(serverCodecConfigurer.getWriters());
    }

    @Override
    protected RouterFunction<ServerResponse> getRoutingFunction(ErrorAttributes errorAttributes) {
        return RouterFunctions.route(RequestPredicates.all(), this::renderErrorResponse);
    }

    private Mono<ServerResponse> renderErrorResponse(ServerRequest request) {
        Throwable error = getError(request);
        String path = request.path();

        // Legacy query shape -> 421
        if (error instanceof OutdatedSdkException) {
            log.warn("Rejected v1 query: path={}", path);
            return createErrorResponse(OutdatedSdkException.STATUS, ErrorResponse.Categories.OUTDATED_SDK,
                    error.getMessage(), path, null);
        }

        // Residual policy that cannot be parsed or lowered -> 422
        if (error instanceof DataFilterException filterError) {
            log.warn("Data filter failed: path={}, code={}, error={}",
                    path, filterError.getCode(), StringSanitizer.forLog(error.getMessage(), 256));
            return createErrorResponse(HttpStatus.UNPROCESSABLE_ENTITY, ErrorResponse.Categories.UNSUPPORTED_POLICY,
                    error.getMessage(), path, filterError.getCode());
        }

        // Engine failures on paths without a fallback -> 502
        if (error instanceof PolicyEngineUnavailableException engineError) {
            log.error("Policy engine unavailable: path={}, kind={}, error={}",
                    path, engineError.getKind(), StringSanitizer.forLog(error.getMessage(), 256));
            return createErrorResponse(HttpStatus.BAD_GATEWAY, ErrorResponse.Categories.POLICY_ENGINE_UNAVAILABLE,
                    "Policy engine unavailable", path, engineError.getKind().name());
        }

        // Validation errors -> 400
        if (error instanceof WebExchangeBindException bindException) {
            String fieldErrors = bindException.getFieldErrors().stream()
                    .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                    .collect(Collectors.joining(", "));

            log.warn("Validation failed: path={}, errors={}", path, fieldErrors);

            return createErrorResponse(HttpStatus.BAD_REQUEST, ErrorResponse.Categories.VALIDATION_ERROR,
                    "Validation failed: " + fieldErrors, path, null);
        }

        // Unreadable body -> 400
        if (error instanceof ServerWebInputException inputException) {
            log.warn("Invalid request body: path={}, reason={}", path, inputException.getReason());
            return createErrorResponse(HttpStatus.BAD_REQUEST, ErrorResponse.Categories.VALIDATION_ERROR,
                    inputException.getReason() != null ? inputException.getReason() : "Invalid request body",
                    path, null);
        }

        // ResponseStatusException -> use its status
        if (error instanceof ResponseStatusException statusException) {
            HttpStatusCode status = statusException.getStatusCode();

            log.warn("Response status exception: path={}, status={}, reason={}",
                    path, status, statusException.getReason());

            return createErrorResponse(status, "request_error",
                    statusException.getReason() != null ? statusException.getReason() : statusException.getMessage(),
                    path, null);
        }

        // Default error handling -> 500
        Map<String, Object> errorAttributes = getErrorAttributes(request, ErrorAttributeOptions.defaults());
        int status = (int) errorAttributes.getOrDefault("status", 500);

        log.error("Unhandled error: path={}, status={}, error={}",
                path, status, error.getMessage(), error);

        return createErrorResponse(
                HttpStatusCode.valueOf(status),
                ErrorResponse.Categories.SERVER_ERROR,
                "An unexpected error occurred",
                path,
                null
        );
    }

    private Mono<ServerResponse> createErrorResponse(HttpStatusCode status, String error, String message,
                                                     String path, String code) {
        ErrorResponse body = ErrorResponse.of(status.value(), error, message, path, code);

        return ServerResponse.status(status)
                .contentType(MediaType.APPLICATION_JSON)
                .body(BodyInserters.fromValue(body));
    }
}
