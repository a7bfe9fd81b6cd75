package com.example.casa.util;

import com.example.casa.exception.AnalysisNotFoundException;
import com.example.casa.exception.AnalysisNotReadyException;
import com.example.casa.exception.CasaAnalysisException;
import com.example.casa.exception.JobStateException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

/**
 * 统一的接口响应体
 */
public final class ApiResponses {

    private ApiResponses() {
    }

    public static Map<String, Object> success() {
        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        return response;
    }

    public static Map<String, Object> error(String message) {
        Map<String, Object> response = new HashMap<>();
        response.put("success", false);
        response.put("error", message);
        response.put("timestamp", LocalDateTime.now().toString());
        return response;
    }

    /**
     * 异常转换为HTTP状态码与错误响应
     */
    public static ResponseEntity<Map<String, Object>> errorEntity(Throwable ex) {
        Map<String, Object> body = error(ex.getMessage());
        if (ex instanceof CasaAnalysisException) {
            body.put("category", ((CasaAnalysisException) ex).getCategory());
        }
        if (ex instanceof AnalysisNotReadyException) {
            body.put("status", ((AnalysisNotReadyException) ex).getStatus());
        }
        return ResponseEntity.status(statusOf(ex)).body(body);
    }

    public static ResponseEntity<Object> errorObject(Throwable ex) {
        ResponseEntity<Map<String, Object>> entity = errorEntity(ex);
        return ResponseEntity.status(entity.getStatusCode()).body(entity.getBody());
    }

    public static HttpStatus statusOf(Throwable ex) {
        if (ex instanceof AnalysisNotFoundException) {
            return HttpStatus.NOT_FOUND;
        }
        if (ex instanceof AnalysisNotReadyException || ex instanceof JobStateException) {
            return HttpStatus.CONFLICT;
        }
        if (ex instanceof IllegalArgumentException) {
            return HttpStatus.BAD_REQUEST;
        }
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }
}
