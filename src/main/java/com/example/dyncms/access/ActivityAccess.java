package com.example.dyncms.access;

import com.example.dyncms.models.Activity;
import java.util.List;

public interface ActivityAccess {

    void put(Activity activity);

    /**
     * Returns the most recent activities, newest first.
     *
     * @param limit maximum number of activities to return
     */
    List<Activity> findRecent(int limit);
}
