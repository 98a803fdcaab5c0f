package github.sarthakdev143.render_kit.integration.color;

import github.sarthakdev143.render_kit.exception.UnsupportedColorSpaceException;
import github.sarthakdev143.render_kit.model.PixelTransform;

import java.util.List;
import java.util.Locale;

/**
 * Color-management collaborator: knows a set of named color spaces and builds transforms between them.
 */
public interface ColorManagement {

    List<String> listColorSpaces();

    /**
     * @throws UnsupportedColorSpaceException when either space is unknown or the pair cannot be converted
     */
    PixelTransform buildTransform(String sourceSpace, String targetSpace);

    default boolean knows(String colorSpace) {
        if (colorSpace == null || colorSpace.isBlank()) {
            return false;
        }
        String wanted = colorSpace.trim().toLowerCase(Locale.ROOT);
        return listColorSpaces().stream().anyMatch(name -> name.toLowerCase(Locale.ROOT).equals(wanted));
    }
}
