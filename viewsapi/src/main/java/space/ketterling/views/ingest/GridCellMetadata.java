package space.ketterling.views.ingest;

/**
 * Static attributes of a grid cell, joined onto summarized draws.
 */
public record GridCellMetadata(int gridId, double latitude, double longitude, String countryId, String admin1Id,
        String admin2Id) {
}
