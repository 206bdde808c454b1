package com.gateprep.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.gateprep.common.constants.ContentKind;

/**
 * One validated piece of study content. Each kind has its own record; the
 * natural key is what the cache uses to recognise duplicates.
 */
public sealed interface GeneratedContent
    permits QuestionContent, FactContent, FormulaContent, LanguageTipContent {

    @JsonIgnore
    ContentKind kind();

    @JsonIgnore
    String naturalKey();
}
