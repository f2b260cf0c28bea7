package me.internalizable.platesight.model;

import java.util.Arrays;
import java.util.Optional;
import java.util.Set;

public enum PlateCategory {
    REGULAR("regular"),
    LIGHT("light"),
    COMMERCIAL("commercial"),
    RENTAL_OR_SHARED("rental"),
    DIPLOMATIC("diplomatic");

    private static final Set<String> RENTAL_KANA = Set.of("わ", "れ");

    private final String label;

    PlateCategory(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static Optional<PlateCategory> fromLabel(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase();
        return Arrays.stream(values())
                .filter(category -> category.label.equals(normalized) || category.name().equalsIgnoreCase(normalized))
                .findFirst();
    }

    /**
     * Rental and car-share plates are identified by their kana alone,
     * whatever category the recognizer reported.
     */
    public static PlateCategory resolve(String kana, String reported) {
        if (kana != null && RENTAL_KANA.contains(kana.trim())) {
            return RENTAL_OR_SHARED;
        }
        return fromLabel(reported).orElse(REGULAR);
    }
}
