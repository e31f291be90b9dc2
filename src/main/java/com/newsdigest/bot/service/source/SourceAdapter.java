package com.newsdigest.bot.service.source;

import com.newsdigest.bot.config.DigestProperties;
import com.newsdigest.bot.exception.SourceUnavailableException;

import java.util.List;

/**
 * 뉴스 소스 어댑터. 소스 유형별로 구현되며 수집 후보 목록만 반환합니다.
 */
public interface SourceAdapter {

    DigestProperties.Source source();

    default String sourceId() {
        return source().getId();
    }

    /**
     * @throws SourceUnavailableException 소스에 접근할 수 없거나 응답을 해석할 수 없는 경우
     */
    List<RawItem> fetch() throws SourceUnavailableException;
}
