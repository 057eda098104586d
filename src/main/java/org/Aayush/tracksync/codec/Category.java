package org.Aayush.tracksync.codec;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;
import org.Aayush.tracksync.core.ValidationException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fixed set of legal record categories.
 *
 * <p>The first constant is the default. Display names are what the attribute codec
 * writes after {@code Category:}. Collections map their own vocabularies onto these.</p>
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public enum Category {
    CYCLING("Cycling"),
    RUNNING("Running"),
    MOUNTAIN_BIKING("Mountain biking"),
    INDOOR_CYCLING("Indoor cycling"),
    SAILING("Sailing"),
    WALKING("Walking"),
    HIKING("Hiking"),
    SWIMMING("Swimming"),
    DRIVING("Driving"),
    OFF_ROAD_DRIVING("Off road driving"),
    MOTOR_RACING("Motor racing"),
    MOTORCYCLING("Motorcycling"),
    ENDURO("Enduro"),
    SKIING("Skiing"),
    CROSS_COUNTRY_SKIING("Cross country skiing"),
    CANOEING("Canoeing"),
    KAYAKING("Kayaking"),
    SEA_KAYAKING("Sea kayaking"),
    STAND_UP_PADDLE_BOARDING("Stand up paddle boarding"),
    ROWING("Rowing"),
    WINDSURFING("Windsurfing"),
    KITEBOARDING("Kiteboarding"),
    ORIENTEERING("Orienteering"),
    MOUNTAINEERING("Mountaineering"),
    SKATING("Skating"),
    SKATEBOARDING("Skateboarding"),
    HORSE_RIDING("Horse riding"),
    HANG_GLIDING("Hang gliding"),
    GLIDING("Gliding"),
    FLYING("Flying"),
    SNOWBOARDING("Snowboarding"),
    PARAGLIDING("Paragliding"),
    HOT_AIR_BALLOONING("Hot air ballooning"),
    NORDIC_WALKING("Nordic walking"),
    SNOWSHOEING("Snowshoeing"),
    JET_SKIING("Jet skiing"),
    POWERBOATING("Powerboating"),
    PEDELEC("Pedelec"),
    CROSSSKATING("Crossskating"),
    HANDCYCLE("Handcycle"),
    MOTORHOME("Motorhome"),
    CABRIOLET("Cabriolet"),
    COACH("Coach"),
    PACK_ANIMAL_TREKKING("Pack animal trekking"),
    TRAIN("Train"),
    MISCELLANEOUS("Miscellaneous");

    private static final Map<String, Category> BY_DISPLAY_NAME;

    static {
        Map<String, Category> map = new LinkedHashMap<>();
        for (Category category : values()) {
            map.put(category.displayName, category);
        }
        BY_DISPLAY_NAME = Collections.unmodifiableMap(map);
    }

    private final String displayName;

    /**
     * Returns the default category (the first legal value).
     */
    public static Category defaultCategory() {
        return values()[0];
    }

    /**
     * Resolves a display name such as {@code "Mountain biking"}.
     *
     * @throws ValidationException when the name is not a legal category.
     */
    public static Category fromDisplayName(String displayName) {
        Category category = displayName == null ? null : BY_DISPLAY_NAME.get(displayName.trim());
        if (category == null) {
            throw new ValidationException(
                    ValidationException.REASON_INVALID_CATEGORY,
                    "Category " + displayName + " is not known");
        }
        return category;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
