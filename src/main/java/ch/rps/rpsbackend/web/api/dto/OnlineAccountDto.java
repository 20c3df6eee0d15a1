package ch.rps.rpsbackend.web.api.dto;

public record OnlineAccountDto(
        Long accountId,
        String name
) {}
