package com.shiplock.remote.northflank;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Northflank-specific configuration bound from {@code shiplock.northflank.*}.
 * <p>
 * Not annotated with {@code @Component}; enabled by {@code NorthflankConfig}.
 */
@ConfigurationProperties(prefix = "shiplock.northflank")
public class NorthflankProperties {

    /** Transport to the control plane: {@code api} (REST) or {@code cli} (northflank binary) */
    private String transport = "api";

    /** REST API base URL */
    private String apiUrl = "https://api.northflank.com";

    /** API token sent as a bearer token. Only used by the api transport. */
    private String apiToken = "";

    /** Northflank project id */
    private String projectId = "";

    /** Northflank service id within the project */
    private String serviceId = "";

    /** Branch recorded with the deployment request */
    private String branch = "main";

    /** Executable used by the cli transport */
    private String cliCommand = "northflank";

    /** Per-call timeout in seconds, for both transports */
    private int requestTimeoutSeconds = 30;

    // -- Getters and Setters --

    public String getTransport() {
        return transport;
    }

    public void setTransport(String transport) {
        this.transport = transport;
    }

    public String getApiUrl() {
        return apiUrl;
    }

    public void setApiUrl(String apiUrl) {
        this.apiUrl = apiUrl;
    }

    public String getApiToken() {
        return apiToken;
    }

    public void setApiToken(String apiToken) {
        this.apiToken = apiToken;
    }

    public String getProjectId() {
        return projectId;
    }

    public void setProjectId(String projectId) {
        this.projectId = projectId;
    }

    public String getServiceId() {
        return serviceId;
    }

    public void setServiceId(String serviceId) {
        this.serviceId = serviceId;
    }

    public String getBranch() {
        return branch;
    }

    public void setBranch(String branch) {
        this.branch = branch;
    }

    public String getCliCommand() {
        return cliCommand;
    }

    public void setCliCommand(String cliCommand) {
        this.cliCommand = cliCommand;
    }

    public int getRequestTimeoutSeconds() {
        return requestTimeoutSeconds;
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = requestTimeoutSeconds;
    }
}
