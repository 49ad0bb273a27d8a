package com.fhi.my_pets.repo;

import java.util.Objects;

import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;

/**
 * A {@link Pageable} addressed by a raw offset and a page size, rather than by page number.
 *
 * <p>Spring Data's {@code PageRequest} only knows offsets that are multiples of the page size;
 * list queries here take any {@code start}, e.g. start=10, limit=12.</p>
 */
public class OffsetLimitPageable implements Pageable
{
    private final long offset;
    private final int  limit;
    private final Sort sort;

    /**
     * @param offset number of records to skip, {@code >= 0}
     * @param limit  page size, {@code >= 1}
     * @param sort   must not be null, use {@link Sort#unsorted()} if needed
     */
    public OffsetLimitPageable(long offset, int limit, Sort sort)
    {
        if (offset < 0)
        {   throw new IllegalArgumentException("Offset must not be negative: " + offset);
        }
        if (limit < 1)
        {   throw new IllegalArgumentException("Limit must be at least 1: " + limit);
        }
        this.offset = offset;
        this.limit  = limit;
        this.sort   = Objects.requireNonNull(sort, "sort");
    }


    @Override
    public int getPageNumber()
    {   return (int) (offset / limit);
    }

    @Override
    public int getPageSize()
    {   return limit;
    }

    @Override
    public long getOffset()
    {   return offset;
    }

    @Override
    public Sort getSort()
    {   return sort;
    }

    @Override
    public Pageable next()
    {   return new OffsetLimitPageable(offset + limit, limit, sort);
    }

    @Override
    public Pageable previousOrFirst()
    {   return hasPrevious() ? new OffsetLimitPageable(Math.max(0, offset - limit), limit, sort)
                             : first();
    }

    @Override
    public Pageable first()
    {   return new OffsetLimitPageable(0, limit, sort);
    }

    @Override
    public Pageable withPage(int pageNumber)
    {   return new OffsetLimitPageable((long) pageNumber * limit, limit, sort);
    }

    @Override
    public boolean hasPrevious()
    {   return offset > 0;
    }


    @Override
    public boolean equals(Object o)
    {
        if (this == o) return true;
        if (!(o instanceof OffsetLimitPageable other)) return false;
        return offset == other.offset && limit == other.limit && sort.equals(other.sort);
    }

    @Override
    public int hashCode()
    {   return Objects.hash(offset, limit, sort);
    }

    @Override
    public String toString()
    {   return "OffsetLimitPageable[offset=" + offset + ", limit=" + limit + ", sort=" + sort + "]";
    }
}
