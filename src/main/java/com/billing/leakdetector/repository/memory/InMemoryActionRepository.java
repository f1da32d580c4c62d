package com.billing.leakdetector.repository.memory;

import com.billing.leakdetector.model.Action;
import com.billing.leakdetector.repository.ActionRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

@Repository
@ConditionalOnProperty(name = "leak.storage.type", havingValue = "memory")
public class InMemoryActionRepository implements ActionRepository {

    // insertion order is append order
    private final List<Action> actions = new CopyOnWriteArrayList<>();

    @Override
    public void append(Action action) {
        actions.add(action);
    }

    @Override
    public List<Action> findByAnomalyId(String anomalyId) {
        List<Action> results = new ArrayList<>();
        for (Action action : actions) {
            if (anomalyId.equals(action.getAnomalyId())) {
                results.add(action);
            }
        }
        return results;
    }

    @Override
    public int deleteByUpload(String uploadId) {
        List<Action> matching = actions.stream()
                .filter(a -> uploadId.equals(a.getUploadId()))
                .toList();
        actions.removeAll(matching);
        return matching.size();
    }
}
