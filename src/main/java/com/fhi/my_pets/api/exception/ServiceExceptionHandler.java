package com.fhi.my_pets.api.exception;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import com.fhi.my_pets.service.exception.ServiceException;
import com.fhi.my_pets.service.exception.ServiceException.Cause;

import lombok.extern.slf4j.Slf4j;


/**
 * Translates service failures into HTTP responses.
 *
 * <p>Lives in the api layer rather than next to {@link ServiceException}: mapping a domain
 * failure to a status code is a concern of the REST boundary, not of the services.</p>
 *
 * <p>Every error response has the same body:</p>
 * <pre>
 *   { "timestamp": "...", "code": "OWNER_NOT_FOUND", "message": "No owner found with ID: 42" }
 * </pre>
 */
@RestControllerAdvice
@Slf4j
public class ServiceExceptionHandler
{
    @ExceptionHandler(ServiceException.class)
    public ResponseEntity<Map<String, Object>> handleServiceException(ServiceException ex)
    {   return errorResponse(mapCauseToStatus(ex.getCauseEnum()), ex.getCauseEnum(), ex.getMessage());
    }


    /**
     * Bean validation failures of a request body.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex)
    {
        String message = ex.getBindingResult().getFieldErrors().stream()
                           .map(e -> e.getField() + ": " + e.getDefaultMessage())
                           .collect(Collectors.joining("; "));
        return errorResponse(HttpStatus.BAD_REQUEST, Cause.INVALID_ARGUMENT, message.isEmpty() ? "Validation failed" : message);
    }

    /**
     * Unparseable body, wrongly typed or missing request parameter.
     */
    @ExceptionHandler({ HttpMessageNotReadableException.class,
                        MethodArgumentTypeMismatchException.class,
                        MissingServletRequestParameterException.class })
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception ex)
    {
        String message = ex instanceof HttpMessageNotReadableException ? "Malformed request body"
                                                                       : ex.getMessage();
        return errorResponse(HttpStatus.BAD_REQUEST, Cause.INVALID_ARGUMENT, message);
    }

    /**
     * Anything that escaped the service boundary. The cause is logged, never returned.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception ex)
    {
        if (ex instanceof ErrorResponse errorResponse)  // Spring MVC's own failures: unknown path, unsupported method...
        {   return errorResponse(errorResponse.getStatusCode(), "HTTP_" + errorResponse.getStatusCode().value(), ex.getMessage());
        }
        log.error("Unhandled exception", ex);
        return errorResponse(HttpStatus.INTERNAL_SERVER_ERROR, Cause.INTERNAL, Cause.INTERNAL.format());
    }



    private ResponseEntity<Map<String, Object>> errorResponse(HttpStatusCode status, Cause cause, String message)
    {   return errorResponse(status, cause.getCode(), message);
    }

    private ResponseEntity<Map<String, Object>> errorResponse(HttpStatusCode status, String code, String message)
    {
        return ResponseEntity.status(status).body(Map.of(
            "timestamp", Instant.now().toString(),
            "code"     , code,
            "message"  , message != null ? message : ""
        ));
    }


    /**
     * Maps the service-level Cause enum to an HTTP status code.
     *
     *   - 404 (Not Found): the requested pet/owner, or the owner referenced by a pet, doesn't exist
     *   - 400 (Bad Request): an argument is invalid
     *   - 409 (Conflict): the operation would break an invariant of existing data
     *   - 500 (Internal Server Error): an unknown or unexpected issue occurred
     */
    private HttpStatus mapCauseToStatus(Cause cause)
    {
        return switch (cause)
        {
            case PET_NOT_FOUND,
                 OWNER_NOT_FOUND  -> HttpStatus.NOT_FOUND;
            case INVALID_ARGUMENT -> HttpStatus.BAD_REQUEST;
            case OWNER_HAS_PETS   -> HttpStatus.CONFLICT;
            case INTERNAL         -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
