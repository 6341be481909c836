package dev.factories.model;

/**
 * A named scheduler job that belongs to one composite instance.
 */
public final class Component {
    private final String name;
    private String handle;
    private String endpoint;
    private InstanceStatus status;

    public Component(String name) {
        this(name, null, null, InstanceStatus.SUBMITTED);
    }

    public Component(String name, String handle, String endpoint, InstanceStatus status) {
        this.name = name;
        this.handle = handle;
        this.endpoint = endpoint;
        this.status = status;
    }

    public String name() { return name; }
    public String handle() { return handle; }
    public String endpoint() { return endpoint; }
    public InstanceStatus status() { return status; }

    public boolean isLive() {
        return !status.isTerminal();
    }

    public void assignHandle(String handle) {
        this.handle = handle;
    }

    public void setEndpoint(String endpoint) {
        this.endpoint = endpoint;
    }

    /**
     * Move to {@code next} if the lifecycle allows it.
     *
     * @return true when the status changed
     */
    public boolean transitionTo(InstanceStatus next) {
        if (!status.canTransitionTo(next)) {
            return false;
        }
        this.status = next;
        return true;
    }

    public ComponentSnapshot snapshot() {
        return new ComponentSnapshot(name, handle, endpoint, status);
    }
}
