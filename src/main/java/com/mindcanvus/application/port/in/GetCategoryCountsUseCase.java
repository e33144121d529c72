package com.mindcanvus.application.port.in;

import com.mindcanvus.domain.model.CategoryCount;

import java.util.List;

public interface GetCategoryCountsUseCase {
    List<CategoryCount> getCategoryCounts();
}
