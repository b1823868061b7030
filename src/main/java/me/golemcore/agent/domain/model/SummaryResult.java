package me.golemcore.agent.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Output of the conversation summarizer. A failed summarization is expressed
 * through {@link #summaryError} and {@code flags.summaryError}, never by
 * throwing.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SummaryResult {

    @Builder.Default
    private String summary = "";

    @Builder.Default
    private List<String> tags = new ArrayList<>();

    @Builder.Default
    private List<String> keywords = new ArrayList<>();

    @Builder.Default
    private List<String> places = new ArrayList<>();

    @Builder.Default
    private Flags flags = new Flags();

    private String summaryError;

    public static SummaryResult failed(String error) {
        return SummaryResult.builder()
                .flags(Flags.builder().summaryError(true).build())
                .summaryError(error)
                .build();
    }

    @JsonIgnore
    public boolean isFailed() {
        return summaryError != null || (flags != null && flags.isSummaryError());
    }

    /**
     * Content-safety and parsing flags.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Flags {
        private boolean explicit;
        private boolean forbidden;
        private boolean summaryError;
    }
}
