package io.ticketring.config;

/**
 * A running load-balancer process reachable over its runtime command channel.
 *
 * @param address {@code tcp://host:port} or {@code unix:///path/to/socket}
 * @param region  region the instance serves; blank means every region
 */
public record InstanceEndpoint(String name, String address, String region) {
    public InstanceEndpoint {
        if (address == null || address.isBlank()) {
            throw new IllegalArgumentException("instance address cannot be empty");
        }
        address = address.trim();
        name = name == null || name.isBlank() ? address : name.trim();
        region = region == null ? "" : region.trim().toLowerCase();
    }

    public static InstanceEndpoint of(String name, String address) {
        return new InstanceEndpoint(name, address, "");
    }

    public boolean servesRegion(String candidate) {
        return region.isEmpty() || region.equalsIgnoreCase(candidate);
    }
}
