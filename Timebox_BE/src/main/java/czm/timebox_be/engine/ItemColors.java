package czm.timebox_be.engine;

import java.util.List;

/**
 * Display colour of a work item, picked from a fixed palette by the last digit of its id.
 */
public class ItemColors {
    private static final List<String> PALETTE = List.of(
            "#3B82F6", "#10B981", "#8B5CF6", "#F59E0B",
            "#EF4444", "#06B6D4", "#84CC16", "#F97316");

    public static String forWorkItem(long workItemId) {
        int lastDigit = (int) Math.abs(workItemId % 10);
        return PALETTE.get(lastDigit % PALETTE.size());
    }
}
