package io.github.galkahana.testrunner.results;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * HTTP request that uploads a full-results document to a results server.
 *
 * @param url upload endpoint
 * @param contentType multipart content type, boundary included
 * @param body encoded form
 */
public record UploadRequest(String url, String contentType, byte[] body) {

    static final String BOUNDARY = "-M-A-G-I-C---B-O-U-N-D-A-R-Y-";
    private static final String CRLF = "\r\n";

    public static UploadRequest make(String server, String builder, String master, String testType,
                                     JsonNode fullResults) {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("builder", builder);
        fields.put("master", master);
        fields.put("testtype", testType);

        StringBuilder form = new StringBuilder();
        fields.forEach((key, value) -> form
                .append("--").append(BOUNDARY).append(CRLF)
                .append("Content-Disposition: form-data; name=\"").append(key).append('"').append(CRLF)
                .append(CRLF)
                .append(value).append(CRLF));
        form.append("--").append(BOUNDARY).append(CRLF)
                .append("Content-Disposition: form-data; name=\"file\"; filename=\"full_results.json\"").append(CRLF)
                .append("Content-Type: application/json").append(CRLF)
                .append(CRLF)
                .append(Json.pretty(fullResults)).append(CRLF)
                .append("--").append(BOUNDARY).append("--").append(CRLF);

        return new UploadRequest("http://" + server + "/testfile/upload",
                "multipart/form-data; boundary=" + BOUNDARY, form.toString().getBytes(StandardCharsets.UTF_8));
    }
}
