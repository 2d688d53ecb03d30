package com.portico.gateway.exception;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Construye los cuerpos JSON de error del gateway.
 *
 * Los mensajes son genéricos: nunca incluyen mensajes de excepción, nombres de clase
 * ni stack traces.
 */
@Component
public class ErrorResponseBuilder {

    private static final Logger logger = LoggerFactory.getLogger(ErrorResponseBuilder.class);
    private static final DateTimeFormatter DATE_TIME_FORMATTER = DateTimeFormatter.ISO_OFFSET_DATE_TIME;

    public static final String BAD_GATEWAY_CODE = "BAD_GATEWAY";
    public static final String INTERNAL_SERVER_ERROR_CODE = "INTERNAL_SERVER_ERROR";

    static final String FALLBACK_JSON = "{\"status\":500,\"error\":\"Internal Server Error\",\"code\":\"INTERNAL_SERVER_ERROR\"}";

    private final ObjectMapper objectMapper;

    public ErrorResponseBuilder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Construye una respuesta de error con código de estado personalizado.
     *
     * @param status Código de estado HTTP
     * @param code Código de error de la aplicación
     * @param error Descripción breve del error
     * @param message Mensaje para el cliente
     * @param path Ruta de la solicitud
     * @param requestId Identificador de la solicitud (puede ser null)
     * @return Mapa ordenado con la estructura de la respuesta
     */
    public Map<String, Object> buildError(int status, String code, String error, String message,
                                          String path, String requestId) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", status);
        body.put("error", error);
        body.put("code", code);
        body.put("message", message);
        body.put("path", path);
        if (requestId != null) {
            body.put("requestId", requestId);
        }
        body.put("timestamp", OffsetDateTime.now().format(DATE_TIME_FORMATTER));
        return body;
    }

    public Map<String, Object> buildBadGatewayError(String path, String requestId) {
        return buildError(
                HttpStatus.BAD_GATEWAY.value(),
                BAD_GATEWAY_CODE,
                HttpStatus.BAD_GATEWAY.getReasonPhrase(),
                "El servicio de destino no está disponible. Por favor, inténtelo más tarde.",
                path,
                requestId);
    }

    public Map<String, Object> buildInternalServerError(String path, String requestId) {
        return buildError(
                HttpStatus.INTERNAL_SERVER_ERROR.value(),
                INTERNAL_SERVER_ERROR_CODE,
                HttpStatus.INTERNAL_SERVER_ERROR.getReasonPhrase(),
                "Ha ocurrido un error interno. Por favor, inténtelo más tarde.",
                path,
                requestId);
    }

    /**
     * Serializa una respuesta de error a JSON.
     *
     * @param errorResponse Estructura de la respuesta
     * @return JSON; un cuerpo fijo de error 500 si la serialización falla
     */
    public String toJson(Map<String, Object> errorResponse) {
        try {
            return objectMapper.writeValueAsString(errorResponse);
        } catch (JsonProcessingException e) {
            logger.error("Error serializando respuesta de error a JSON", e);
            return FALLBACK_JSON;
        }
    }
}
