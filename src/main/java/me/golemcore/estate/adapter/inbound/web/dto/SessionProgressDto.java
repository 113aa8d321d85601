package me.golemcore.estate.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Progress of the current turn of a search session.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionProgressDto {
    private String key;
    private long turn;
    private String phase;
    private boolean finalized;
    private int listingCount;
    private int expectedGeocodeCount;
    private int arrivedGeocodeCount;
    private int expectedPoiCount;
    private int arrivedPoiCount;
    private boolean communityRequested;
    private boolean communityArrived;
    private String turnStartedAt;
    private String stageDeadline;
    private String lastActivityAt;
}
