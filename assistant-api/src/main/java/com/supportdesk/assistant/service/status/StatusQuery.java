package com.supportdesk.assistant.service.status;

public record StatusQuery(StatusQueryType type, StatusFilters filters) {

    public StatusQuery {
        filters = filters == null ? StatusFilters.none() : filters;
    }

    public static StatusQuery of(StatusQueryType type) {
        return new StatusQuery(type, StatusFilters.none());
    }

    public String cacheKey() {
        return type.label() + ":" + filters.canonical();
    }
}
