package com.sunny.jobconsole.core.util;

import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.sunny.jobconsole.core.biz.model.ReturnT;
import com.sunny.jobconsole.core.exception.ExecutorInvokeException;
import com.sunny.jobconsole.core.exception.ExecutorInvokeException.FailureType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * JSON-over-HTTP POST to an executor.
 * <p>
 * Every failure is reported as an {@link ExecutorInvokeException} classified by {@link FailureType},
 * a returned value is always a decoded {@code {code,msg,content}} object.
 *
 * @author Sunny
 * @version 1.0.0
 * @since 2025-12-08
 */
public class JobRemotingUtil {
    private static final Logger logger = LoggerFactory.getLogger(JobRemotingUtil.class);

    public static final String XXL_JOB_ACCESS_TOKEN = "XXL-JOB-ACCESS-TOKEN";

    private static final Map<Integer, HttpClient> CLIENTS = new ConcurrentHashMap<>();

    private static HttpClient client(int timeoutSeconds) {
        return CLIENTS.computeIfAbsent(timeoutSeconds, seconds -> HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(seconds))
                .followRedirects(HttpClient.Redirect.NEVER)
                .build());
    }

    /**
     * post
     *
     * @param url            full request url
     * @param accessToken    sent as header when not blank
     * @param timeoutSeconds connect and request timeout
     * @param requestObj     serialized with gson
     * @param returnTargClassOfT type of {@code content}
     * @return decoded answer, whatever its code
     * @throws ExecutorInvokeException when no well-formed answer came back
     */
    public static <T> ReturnT<T> postBody(String url, String accessToken, int timeoutSeconds, Object requestObj, Class<T> returnTargClassOfT) {
        String body = requestObj == null ? "" : GsonTool.toJson(requestObj);
        if (logger.isDebugEnabled()) {
            logger.debug(">>>>>>>>>>> jobconsole, remoting request:\n{}", formatCurl(url, accessToken, body));
        }

        HttpRequest request;
        try {
            HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(url))
                    .timeout(Duration.ofSeconds(timeoutSeconds))
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8));
            if (StringTool.isNotBlank(accessToken)) {
                builder.header(XXL_JOB_ACCESS_TOKEN, accessToken.trim());
            }
            request = builder.build();
        } catch (IllegalArgumentException e) {
            throw new ExecutorInvokeException(FailureType.CONNECT_ERROR, e, "invalid executor address: %s", url);
        }

        HttpResponse<String> response;
        try {
            response = client(timeoutSeconds).send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (HttpConnectTimeoutException e) {
            throw new ExecutorInvokeException(FailureType.CONNECT_ERROR, e, "connect to executor timed out: %s", url);
        } catch (HttpTimeoutException e) {
            throw new ExecutorInvokeException(FailureType.TIMEOUT_ERROR, e, "executor did not answer within %ss: %s", timeoutSeconds, url);
        } catch (ConnectException e) {
            throw new ExecutorInvokeException(FailureType.CONNECT_ERROR, e, "cannot connect to executor: %s", url);
        } catch (IOException e) {
            throw new ExecutorInvokeException(FailureType.CONNECT_ERROR, e, "call executor failed: %s, %s", url, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExecutorInvokeException(FailureType.CONNECT_ERROR, e, "call executor interrupted: %s", url);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new ExecutorInvokeException(FailureType.REMOTE_STATUS_ERROR, status, null,
                    "executor answered http status %s: %s", status, url);
        }
        return decode(url, response.body(), returnTargClassOfT);
    }

    private static <T> ReturnT<T> decode(String url, String responseBody, Class<T> returnTargClassOfT) {
        try {
            JsonElement element = JsonParser.parseString(responseBody == null ? "" : responseBody);
            if (!element.isJsonObject() || !element.getAsJsonObject().has("code")) {
                throw new ExecutorInvokeException(FailureType.DECODE_ERROR,
                        "executor answer is not a {code,msg,content} object: %s", url);
            }
            return GsonTool.fromReturnT(element, returnTargClassOfT);
        } catch (JsonParseException | IllegalStateException | NumberFormatException e) {
            throw new ExecutorInvokeException(FailureType.DECODE_ERROR, e, "decode executor answer failed: %s", url);
        }
    }

    /**
     * Equivalent curl command of a request, used to replay a trigger by hand.
     */
    public static String formatCurl(String url, String accessToken, String body) {
        StringBuilder command = new StringBuilder();
        command.append("curl -sS -X POST \"").append(url).append("\"");
        command.append(" \\\n  -H \"Content-Type: application/json\"");
        if (StringTool.isNotBlank(accessToken)) {
            command.append(" \\\n  -H \"").append(XXL_JOB_ACCESS_TOKEN).append(": ").append(accessToken.trim()).append("\"");
        }
        String payload = body == null ? "" : body.replace("'", "'\"'\"'");
        command.append(" \\\n  -d '").append(payload).append("'");
        return command.toString();
    }

}
