package envmonitor.config;

public final class ApiRoutes {

    private ApiRoutes() {}

    // Versión base
    public static final String CURRENT_VERSION = "/api/v1";

    // Rutas específicas
    public static final String READINGS = CURRENT_VERSION + "/readings";
    public static final String ALERTS = CURRENT_VERSION + "/alerts";
    public static final String MODELS = CURRENT_VERSION + "/models";
    public static final String PIPELINE = CURRENT_VERSION + "/pipeline";

    // Topics STOMP
    public static final String TOPIC_READINGS = "/topic/readings/";
    public static final String TOPIC_ALERTS = "/topic/alerts";
}
