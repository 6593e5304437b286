package dev.univer.worktracker.web.dto;

import java.util.List;

public record UsersResponse(List<String> users) {}
