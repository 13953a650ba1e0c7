package io.vaultflow.model;

public final class Actors {
    public static final String SYSTEM = "system";

    private Actors() {
    }

    /**
     * Process-wide identity used when the caller does not name an actor.
     */
    public static String current() {
        String user = System.getProperty("user.name");
        return user == null || user.isBlank() ? SYSTEM : user.trim();
    }

    public static String orSystem(String actor) {
        return actor == null || actor.isBlank() ? SYSTEM : actor.trim();
    }
}
