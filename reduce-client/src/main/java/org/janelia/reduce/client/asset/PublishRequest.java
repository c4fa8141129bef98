package org.janelia.reduce.client.asset;

import java.io.Serializable;
import java.util.Date;

import org.janelia.reduce.json.JsonUtils;

/**
 * Request to publish a staged project folder.
 *
 * @author Eric Trautman
 */
public class PublishRequest
        implements Serializable {

    private final String sourcePath;
    private final Long taskId;
    private final String description;
    private final Date requestTimestamp;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private PublishRequest() {
        this(null, null, null, null);
    }

    public PublishRequest(final String sourcePath,
                          final Long taskId,
                          final String description,
                          final Date requestTimestamp) {
        this.sourcePath = sourcePath;
        this.taskId = taskId;
        this.description = description;
        this.requestTimestamp = requestTimestamp;
    }

    public String getSourcePath() {
        return sourcePath;
    }

    public Long getTaskId() {
        return taskId;
    }

    public String getDescription() {
        return description;
    }

    public Date getRequestTimestamp() {
        return requestTimestamp;
    }

    public String toJson() {
        return JSON_HELPER.toJson(this);
    }

    public static PublishRequest fromJson(final String json) {
        return JSON_HELPER.fromJson(json);
    }

    private static final JsonUtils.Helper<PublishRequest> JSON_HELPER = new JsonUtils.Helper<>(PublishRequest.class);
}
