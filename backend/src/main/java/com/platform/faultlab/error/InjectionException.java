package com.platform.faultlab.error;

/**
 * Raised when mutating a node fails while injecting or restoring a fault.
 */
public class InjectionException extends FaultLabException {

    private final String node;
    private final String operation;

    public InjectionException(ErrorCode errorCode, String node, String operation, String message) {
        super(errorCode, message);
        this.node = node;
        this.operation = operation;
    }

    public InjectionException(ErrorCode errorCode, String node, String operation, String message, Throwable cause) {
        super(errorCode, message, cause);
        this.node = node;
        this.operation = operation;
    }

    public static InjectionException stopFailed(String node, Throwable cause) {
        return new InjectionException(ErrorCode.INJECTION_FAILED, node, "stop",
            String.format("Failed to stop node %s: %s", node, cause.getMessage()), cause);
    }

    public static InjectionException disconnectFailed(String node, String network, Throwable cause) {
        return new InjectionException(ErrorCode.INJECTION_FAILED, node, "disconnect",
            String.format("Failed to disconnect node %s from %s: %s", node, network, cause.getMessage()), cause);
    }

    public static InjectionException verificationFailed(String node, String network, boolean expectMember) {
        return new InjectionException(ErrorCode.PARTITION_VERIFICATION_FAILED, node,
            expectMember ? "connect" : "disconnect",
            String.format("Node %s %s network %s after %s", node,
                expectMember ? "does not list" : "still lists", network,
                expectMember ? "connect" : "disconnect"));
    }

    public static InjectionException startFailed(String node, Throwable cause) {
        return new InjectionException(ErrorCode.RESTORATION_FAILED, node, "start",
            String.format("Failed to start node %s: %s", node, cause.getMessage()), cause);
    }

    public static InjectionException connectFailed(String node, String network, Throwable cause) {
        return new InjectionException(ErrorCode.RESTORATION_FAILED, node, "connect",
            String.format("Failed to reconnect node %s to %s: %s", node, network, cause.getMessage()), cause);
    }

    public String getNode() {
        return node;
    }

    public String getOperation() {
        return operation;
    }
}
