package com.sunny.jobconsole.admin.handler;

import com.sunny.jobconsole.core.biz.model.ReturnT;
import com.sunny.jobconsole.core.constant.Code;
import com.sunny.jobconsole.core.exception.JobConsoleException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * 全局异常处理
 *
 * @author Sunny
 * @version 1.0.0
 * @since 2025-12-08
 */
@RestControllerAdvice
public class AdminExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(AdminExceptionHandler.class);

    @ExceptionHandler(JobConsoleException.class)
    public ResponseEntity<ReturnT<String>> handleJobConsoleException(JobConsoleException e) {
        if (e.getCode() >= Code.INTERNAL_ERROR) {
            log.error("业务异常: type={}, msg={}", e.getType(), e.getMessage(), e);
        } else {
            log.warn("业务异常: type={}, msg={}", e.getType(), e.getMessage());
        }
        return ResponseEntity.status(e.getCode()).body(ReturnT.of(e.getCode(), e.getMessage(), null));
    }

    @ExceptionHandler({MissingServletRequestParameterException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ReturnT<String>> handleBadParameter(Exception e) {
        log.warn("参数错误: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ReturnT.of(Code.BAD_REQUEST, e.getMessage(), null));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ReturnT<String>> handleException(Exception e) {
        log.error("系统异常", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ReturnT.of(Code.INTERNAL_ERROR, "系统异常: " + e.getMessage(), null));
    }
}
