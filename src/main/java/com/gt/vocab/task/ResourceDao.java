package com.gt.vocab.task;

import com.gt.vocab.model.Resource;
import com.gt.vocab.model.Word;

import java.util.Collection;
import java.util.List;

public interface ResourceDao {

    // Returns null when nothing is cached under the key
    Resource findByCacheKey(String cacheKey);

    // Returns the stored resource; when another writer stored the key first, its resource wins
    Resource createResource(String text, String cacheKey, Collection<Word> words);

    List<Resource> loadResources(Collection<Long> resourceIds);
}
