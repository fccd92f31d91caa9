package com.dealtracker.poller.infrastructure.db.mapper;

import com.dealtracker.poller.domain.listing.Store;
import com.dealtracker.poller.infrastructure.db.StoreRow;
import java.time.Instant;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

@Mapper(componentModel = "spring")
public interface StoreRowMapper {

    @Mapping(target = "id", source = "store.storeId")
    @Mapping(target = "firstSeenAt", source = "seenAt")
    @Mapping(target = "lastSeenAt", source = "seenAt")
    StoreRow toRow(Store store, Instant seenAt);
}
