package com.sunny.jobconsole.core.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class JobRemotingUtilTest {

    @Test
    void formatCurl_shouldRenderWithoutToken() {
        String command = JobRemotingUtil.formatCurl("http://localhost:9999/run", null, "{\"key\":\"value\"}");

        String expected = String.join("\n",
                "curl -sS -X POST \"http://localhost:9999/run\" \\",
                "  -H \"Content-Type: application/json\" \\",
                "  -d '{\"key\":\"value\"}'");
        assertEquals(expected, command);
    }

    @Test
    void formatCurl_shouldTrimTokenAndEscapeQuotes() {
        String command = JobRemotingUtil.formatCurl("http://localhost:9999/run", " default_token ", "{\"p\":\"it's\"}");

        String expected = String.join("\n",
                "curl -sS -X POST \"http://localhost:9999/run\" \\",
                "  -H \"Content-Type: application/json\" \\",
                "  -H \"XXL-JOB-ACCESS-TOKEN: default_token\" \\",
                "  -d '{\"p\":\"it'\"'\"'s\"}'");
        assertEquals(expected, command);
    }
}
