package vkgraph.vk;

/** A VK API call could not be completed within its retry budget. */
public class FatalApiException extends Exception {
    private final String method;

    public FatalApiException(String method, String message, Throwable cause) {
        super(method + ": " + message, cause);
        this.method = method;
    }

    public String method() {
        return method;
    }
}
