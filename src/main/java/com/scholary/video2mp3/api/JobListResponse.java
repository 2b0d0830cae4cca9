package com.scholary.video2mp3.api;

import java.util.List;

public record JobListResponse(List<JobResponse> jobs) {}
