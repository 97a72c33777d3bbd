package com.croppulse.decision.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Registered farm location")
public class Farm {

    @Schema(description = "Farm identifier", example = "FARM-001")
    private String farmId;

    @Schema(description = "Owning farmer", example = "FARMER-001")
    private String farmerId;

    @Schema(description = "County the farm is registered in", example = "Nakuru")
    private String county;

    @Schema(description = "Latitude in decimal degrees", example = "-0.3031")
    private double latitude;

    @Schema(description = "Longitude in decimal degrees", example = "36.0800")
    private double longitude;

    @Schema(description = "Main crop", example = "maize")
    private String cropType;

    /**
     * Great-circle distance to another farm in kilometres.
     */
    public double distanceKmTo(Farm other) {
        double lat1 = Math.toRadians(latitude);
        double lat2 = Math.toRadians(other.latitude);
        double dLat = lat2 - lat1;
        double dLon = Math.toRadians(other.longitude - longitude);
        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(lat1) * Math.cos(lat2) * Math.sin(dLon / 2) * Math.sin(dLon / 2);
        return 6371.0 * 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
    }
}
