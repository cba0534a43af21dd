package com.skanga.sqlbridge;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.skanga.sqlbridge.config.CliUtils;
import com.skanga.sqlbridge.config.ConfigParams;
import com.skanga.sqlbridge.config.ConfigurationException;
import com.skanga.sqlbridge.config.ResourceManager;
import com.skanga.sqlbridge.db.ColumnInfo;
import com.skanga.sqlbridge.db.ConnectionPool;
import com.skanga.sqlbridge.db.HikariConnectionPool;
import com.skanga.sqlbridge.db.SchemaCatalog;
import com.skanga.sqlbridge.db.TableResource;
import com.skanga.sqlbridge.db.TransactionLifecycle;
import com.skanga.sqlbridge.tools.PayloadEncoder;
import com.skanga.sqlbridge.tools.SqlTool;
import com.skanga.sqlbridge.tools.ToolDispatcher;
import com.skanga.sqlbridge.tools.ToolInvocation;
import com.skanga.sqlbridge.tools.ToolResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.sql.SQLException;
import java.util.List;

/**
 * MCP server exposing one relational database over JSON-RPC 2.0 on stdio.
 * Table schemas are published as resources and five SQL tools run each statement inside
 * a transaction whose commit rule depends on the tool.
 */
public class McpServer {
    static final String LATEST_PROTOCOL_VERSION = "2025-06-18";
    static final List<String> SUPPORTED_PROTOCOL_VERSIONS = List.of(LATEST_PROTOCOL_VERSION, "2025-03-26", "2024-11-05");

    private static final Logger logger = LoggerFactory.getLogger(McpServer.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();

    private final ConnectionPool connectionPool;
    private final SchemaCatalog schemaCatalog;
    private final ToolDispatcher toolDispatcher;

    // Lifecycle management
    enum ServerState {
        UNINITIALIZED,
        INITIALIZING,
        INITIALIZED,
        SHUTDOWN
    }

    private volatile ServerState serverState = ServerState.UNINITIALIZED;

    /**
     * Creates a server with a pool built from the given configuration.
     *
     * @param configParams Database address and pool settings
     * @throws IllegalStateException if the pool cannot be initialized
     */
    public McpServer(ConfigParams configParams) {
        this(createConnectionPool(configParams), configParams.databaseAddress().resourceBase());
    }

    /**
     * Creates a server over an existing pool. The server takes ownership and closes it on shutdown.
     *
     * @param connectionPool Pool shared by resource reads and tool calls
     * @param resourceBase Base URI for table resources, free of credentials
     */
    public McpServer(ConnectionPool connectionPool, URI resourceBase) {
        this.connectionPool = connectionPool;
        this.schemaCatalog = new SchemaCatalog(connectionPool, resourceBase);
        this.toolDispatcher = new ToolDispatcher(new TransactionLifecycle(connectionPool));
    }

    private static ConnectionPool createConnectionPool(ConfigParams configParams) {
        return new HikariConnectionPool(configParams);
    }

    /**
     * Processes one JSON-RPC message.
     *
     * @param requestNode The parsed JSON-RPC request
     * @return the response, or null for notifications (messages without an id)
     */
    JsonNode handleRequest(JsonNode requestNode) {
        String requestMethod = requestNode.path("method").asText();
        JsonNode requestParams = requestNode.path("params");
        boolean isNotification = !requestNode.has("id");
        JsonNode requestId = isNotification ? null : requestNode.get("id");

        logger.debug("Handling request: method={}, id={}, isNotification={}, state={}",
                requestMethod, requestId, isNotification, serverState);

        try {
            enforceLifecycleRules(requestMethod);
            JsonNode resultNode = executeMethod(requestMethod, requestParams);
            return isNotification ? null : createSuccessResponse(resultNode, requestId);
        } catch (Exception e) {
            return handleRequestException(e, requestMethod, isNotification, requestId);
        }
    }

    private void enforceLifecycleRules(String requestMethod) {
        if (serverState == ServerState.SHUTDOWN) {
            throw new LifecycleViolationException(ResourceManager.getErrorMessage("lifecycle.shutdown"));
        }
        if (serverState == ServerState.UNINITIALIZED && !requestMethod.equals("initialize")) {
            throw new LifecycleViolationException(ResourceManager.getErrorMessage("lifecycle.not.initialized"));
        }
        if (serverState == ServerState.INITIALIZING && !requestMethod.equals("notifications/initialized")
                && !requestMethod.equals("ping")) {
            throw new LifecycleViolationException(ResourceManager.getErrorMessage("lifecycle.initializing"));
        }
    }

    private JsonNode executeMethod(String requestMethod, JsonNode requestParams) throws SQLException {
        return switch (requestMethod) {
            case "initialize" -> handleInitialize(requestParams);
            case "notifications/initialized" -> handleNotificationInitialized();
            case "ping" -> objectMapper.createObjectNode();
            case "tools/list" -> handleListTools();
            case "tools/call" -> handleCallTool(requestParams);
            case "resources/list" -> handleListResources();
            case "resources/read" -> handleReadResource(requestParams);
            default -> throw new MethodNotFoundException(
                    ResourceManager.getErrorMessage("protocol.method.not.found", requestMethod));
        };
    }

    private JsonNode handleRequestException(Exception theException, String requestMethod,
                                            boolean isNotification, JsonNode requestId) {
        if (isNotification) {
            logger.warn("Failed notification {}: {}", requestMethod, theException.getMessage());
            return null;
        }

        if (theException instanceof LifecycleViolationException) {
            logger.warn("Lifecycle violation: {}", theException.getMessage());
            return createErrorResponse(ErrorCode.INVALID_REQUEST, theException.getMessage(), requestId);
        }
        if (theException instanceof MethodNotFoundException) {
            logger.warn(theException.getMessage());
            return createErrorResponse(ErrorCode.METHOD_NOT_FOUND, theException.getMessage(), requestId);
        }
        if (theException instanceof IllegalArgumentException) {
            logger.warn("Invalid request parameters: {}", theException.getMessage());
            return createErrorResponse(ErrorCode.INVALID_PARAMS, theException.getMessage(), requestId);
        }
        if (theException instanceof SQLException) {
            logger.warn("Database error in {}: {}", requestMethod, theException.getMessage());
            return createErrorResponse(ErrorCode.DATABASE_ERROR, theException.getMessage(), requestId);
        }

        logger.error("Unexpected error handling request", theException);
        return createErrorResponse(ErrorCode.INTERNAL_ERROR, "Internal error: " + theException.getMessage(), requestId);
    }

    private JsonNode handleInitialize(JsonNode requestParams) {
        if (serverState != ServerState.UNINITIALIZED) {
            throw new LifecycleViolationException("Server already initialized or in wrong state: " + serverState);
        }

        String clientProtocolVersion = requestParams.path("protocolVersion").asText("");
        String negotiatedVersion = SUPPORTED_PROTOCOL_VERSIONS.contains(clientProtocolVersion)
                ? clientProtocolVersion : LATEST_PROTOCOL_VERSION;
        if (!negotiatedVersion.equals(clientProtocolVersion)) {
            logger.warn("Client requested protocol version '{}', offering {}", clientProtocolVersion, negotiatedVersion);
        }

        serverState = ServerState.INITIALIZING;
        logger.info("Server initializing with protocol version {}", negotiatedVersion);

        ObjectNode resultNode = objectMapper.createObjectNode();
        resultNode.put("protocolVersion", negotiatedVersion);

        ObjectNode capabilitiesNode = resultNode.putObject("capabilities");
        capabilitiesNode.putObject("tools").put("listChanged", false);
        ObjectNode resourcesNode = capabilitiesNode.putObject("resources");
        resourcesNode.put("subscribe", false);
        resourcesNode.put("listChanged", false);

        ObjectNode serverInfoNode = resultNode.putObject("serverInfo");
        serverInfoNode.put("name", CliUtils.SERVER_NAME);
        serverInfoNode.put("version", CliUtils.SERVER_VERSION);
        return resultNode;
    }

    private JsonNode handleNotificationInitialized() {
        if (serverState == ServerState.INITIALIZING) {
            serverState = ServerState.INITIALIZED;
            logger.info("Server initialized and ready for operation");
        }
        return null;
    }

    private JsonNode handleListTools() {
        ArrayNode toolsNode = objectMapper.createArrayNode();
        for (SqlTool sqlTool : toolDispatcher.listTools()) {
            ObjectNode toolNode = toolsNode.addObject();
            toolNode.put("name", sqlTool.toolName());
            toolNode.put("description", sqlTool.description());

            ObjectNode inputSchema = toolNode.putObject("inputSchema");
            inputSchema.put("type", "object");
            inputSchema.putObject("properties").putObject(SqlTool.SQL_ARGUMENT).put("type", "string");
            inputSchema.putArray("required").add(SqlTool.SQL_ARGUMENT);
        }

        ObjectNode resultNode = objectMapper.createObjectNode();
        resultNode.set("tools", toolsNode);
        return resultNode;
    }

    private JsonNode handleCallTool(JsonNode requestParams) {
        JsonNode nameNode = requestParams.path("name");
        if (!nameNode.isTextual()) {
            throw new IllegalArgumentException(ResourceManager.getErrorMessage("protocol.params.missing", "name"));
        }
        JsonNode sqlNode = requestParams.path("arguments").path(SqlTool.SQL_ARGUMENT);
        String sqlText = sqlNode.isTextual() ? sqlNode.asText() : null;

        ToolResult toolResult = toolDispatcher.callTool(new ToolInvocation(nameNode.asText(), sqlText));

        ObjectNode resultNode = objectMapper.createObjectNode();
        ObjectNode contentNode = resultNode.putArray("content").addObject();
        contentNode.put("type", "text");
        contentNode.put("text", toolResult.text());
        resultNode.put("isError", toolResult.isError());
        return resultNode;
    }

    private JsonNode handleListResources() throws SQLException {
        ArrayNode resourceArray = objectMapper.createArrayNode();
        for (TableResource tableResource : schemaCatalog.listResources()) {
            ObjectNode resourceNode = resourceArray.addObject();
            resourceNode.put("uri", tableResource.uri());
            resourceNode.put("mimeType", tableResource.mimeType());
            resourceNode.put("name", tableResource.name());
        }

        ObjectNode resultNode = objectMapper.createObjectNode();
        resultNode.set("resources", resourceArray);
        return resultNode;
    }

    private JsonNode handleReadResource(JsonNode requestParams) throws SQLException {
        JsonNode uriNode = requestParams.path("uri");
        if (!uriNode.isTextual()) {
            throw new IllegalArgumentException(ResourceManager.getErrorMessage("protocol.params.missing", "uri"));
        }
        String uri = uriNode.asText();
        List<ColumnInfo> tableColumns = schemaCatalog.readResource(uri);

        ObjectNode resultNode = objectMapper.createObjectNode();
        ObjectNode contentNode = resultNode.putArray("contents").addObject();
        contentNode.put("uri", uri);
        contentNode.put("mimeType", TableResource.MIME_TYPE);
        contentNode.put("text", PayloadEncoder.encode(tableColumns));
        return resultNode;
    }

    private static JsonNode createSuccessResponse(JsonNode resultNode, JsonNode requestId) {
        ObjectNode responseNode = objectMapper.createObjectNode();
        responseNode.put("jsonrpc", "2.0");
        responseNode.set("id", requestId == null ? NullNode.getInstance() : requestId);
        responseNode.set("result", resultNode);
        return responseNode;
    }

    static JsonNode createErrorResponse(ErrorCode errorCode, String message, JsonNode requestId) {
        ObjectNode responseNode = objectMapper.createObjectNode();
        responseNode.put("jsonrpc", "2.0");
        responseNode.set("id", requestId == null ? NullNode.getInstance() : requestId);

        ObjectNode errorNode = responseNode.putObject("error");
        errorNode.put("code", errorCode.code());
        errorNode.put("message", message);
        return responseNode;
    }

    /**
     * Serves newline-delimited JSON-RPC until the reader is exhausted.
     */
    void runStdio(BufferedReader bufferedReader, PrintWriter printWriter) throws IOException {
        String currLine;
        while ((currLine = bufferedReader.readLine()) != null) {
            if (currLine.isBlank()) {
                continue;
            }
            JsonNode responseNode;
            try {
                responseNode = handleRequest(objectMapper.readTree(currLine));
            } catch (JsonProcessingException e) {
                logger.warn("Unparseable request: {}", e.getMessage());
                responseNode = createErrorResponse(ErrorCode.PARSE_ERROR, "Parse error: " + e.getOriginalMessage(), null);
            }

            if (responseNode != null) {
                printWriter.println(objectMapper.writeValueAsString(responseNode));
                printWriter.flush();
            }
        }
    }

    /**
     * Starts the server on stdin/stdout. Blocks until stdin is closed.
     *
     * @throws IOException if stdin cannot be read
     */
    public void startStdioMode() throws IOException {
        logger.info("Starting {} in stdio mode...", CliUtils.SERVER_NAME);

        BufferedReader bufferedReader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        PrintWriter printWriter = new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8), true);
        runStdio(bufferedReader, printWriter);

        logger.info("{} stopped.", CliUtils.SERVER_NAME);
    }

    ServerState getServerState() {
        return serverState;
    }

    /**
     * Closes the connection pool. Idempotent.
     */
    public void shutdown() {
        if (serverState == ServerState.SHUTDOWN) {
            return;
        }

        logger.info("Shutting down MCP server...");
        serverState = ServerState.SHUTDOWN;
        connectionPool.close();
        logger.info("MCP server shutdown complete");
    }

    /**
     * Loads configuration, connects to the database and serves stdio until stdin closes.
     * Exits with 0 after --help or --version, 2 on configuration errors, 1 if the database
     * cannot be reached and 3 on anything unexpected.
     *
     * @param args Command line arguments
     */
    public static void main(String[] args) {
        if (CliUtils.handleHelpAndVersion(args, System.out)) {
            System.exit(0);
        }

        try {
            ConfigParams configParams = CliUtils.loadConfiguration(args);
            McpServer mcpServer = new McpServer(configParams);
            Runtime.getRuntime().addShutdownHook(new Thread(mcpServer::shutdown));

            mcpServer.startStdioMode();
            mcpServer.shutdown();
        } catch (ConfigurationException e) {
            logger.error("{}", ResourceManager.getErrorMessage("startup.config.error.title"));
            logger.error("{}", e.getMessage());
            logger.error("{}", ResourceManager.getErrorMessage("startup.config.error.usage"));
            System.exit(2);
        } catch (IllegalStateException | IOException e) {
            logger.error("Failed to start server: {}", e.getMessage(), e);
            System.exit(1);
        } catch (Exception e) {
            logger.error("{}", ResourceManager.getErrorMessage("startup.unexpected.error", e.getMessage()), e);
            System.exit(3);
        }
    }

    /**
     * JSON-RPC error codes used in responses.
     */
    enum ErrorCode {
        PARSE_ERROR(-32700),
        INVALID_REQUEST(-32600),
        METHOD_NOT_FOUND(-32601),
        INVALID_PARAMS(-32602),
        INTERNAL_ERROR(-32603),
        DATABASE_ERROR(-32000);

        private final int code;

        ErrorCode(int code) {
            this.code = code;
        }

        int code() {
            return code;
        }
    }

    private static final class MethodNotFoundException extends RuntimeException {
        MethodNotFoundException(String message) {
            super(message);
        }
    }

    private static final class LifecycleViolationException extends RuntimeException {
        LifecycleViolationException(String message) {
            super(message);
        }
    }
}
