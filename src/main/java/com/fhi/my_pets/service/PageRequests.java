package com.fhi.my_pets.service;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;

import com.fhi.my_pets.repo.OffsetLimitPageable;
import com.fhi.my_pets.service.exception.ServiceException;

/**
 * Turns the optional {@code start} / {@code limit} arguments of list queries into a pageable,
 * applying defaults and bounds. Records are always listed by ascending id.
 */
@Component
public class PageRequests
{
    private final int defaultLimit;
    private final int maxLimit;

    public PageRequests(@Value("${app.pagination.default-limit:12}") int defaultLimit,
                        @Value("${app.pagination.max-limit:100}")    int maxLimit)
    {   this.defaultLimit = defaultLimit;
        this.maxLimit     = maxLimit;
    }


    /**
     * @param start offset of the first record, null for 0
     * @param limit page size, null for the configured default
     * @throws ServiceException INVALID_ARGUMENT if start is negative or limit is out of [1, max-limit]
     */
    public OffsetLimitPageable of(Integer start, Integer limit)
    {
        int offset   = start != null ? start : 0;
        int pageSize = limit != null ? limit : defaultLimit;

        if (offset < 0)
        {   throw ServiceException.invalidArgument("start", "must not be negative");
        }
        if (pageSize < 1 || pageSize > maxLimit)
        {   throw ServiceException.invalidArgument("limit", "must be between 1 and " + maxLimit);
        }
        return new OffsetLimitPageable(offset, pageSize, Sort.by("id"));
    }
}
