package vkgraph.vk;

/** A response payload did not have the structure the caller expected. */
public class UnexpectedShapeException extends Exception {
    public UnexpectedShapeException(String message) {
        super(message);
    }
}
