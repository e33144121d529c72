package com.mindcanvus.application.port.in;

import com.mindcanvus.domain.error.ValidationError;
import com.mindcanvus.domain.model.Page;
import com.mindcanvus.domain.model.PageRequest;
import com.mindcanvus.domain.model.PostDetails;
import com.mindcanvus.domain.model.PostFilter;
import com.mindcanvus.domain.model.PostSort;
import com.mindcanvus.domain.model.Result;

public interface ListPostsUseCase {
    Result<Page<PostDetails>, ValidationError> listPosts(PostFilter filter, PostSort sort, PageRequest pageRequest);
}
