package com.dealtracker.poller.infrastructure.db.mapper;

import com.dealtracker.poller.domain.listing.Listing;
import com.dealtracker.poller.domain.listing.PriceObservation;
import com.dealtracker.poller.infrastructure.db.ListingRow;
import com.dealtracker.poller.infrastructure.db.PriceObservationRow;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

@Mapper(componentModel = "spring")
public interface ListingRowMapper {

    @Mapping(target = "id", ignore = true)
    @Mapping(target = "externalId", source = "listingId")
    @Mapping(target = "firstSeenAt", source = "firstSeen")
    @Mapping(target = "lastSeenAt", source = "lastSeen")
    ListingRow toRow(Listing listing);

    @Mapping(target = "listingId", source = "externalId")
    @Mapping(target = "firstSeen", source = "firstSeenAt")
    @Mapping(target = "lastSeen", source = "lastSeenAt")
    Listing toDomain(ListingRow row);

    @Mapping(target = "listingExternalId", source = "listingId")
    PriceObservationRow toRow(PriceObservation observation);

    @Mapping(target = "listingId", source = "listingExternalId")
    PriceObservation toDomain(PriceObservationRow row);
}
