package com.example.dyncms.access;

import com.example.dyncms.models.Setting;
import java.util.Optional;

public interface SettingAccess {

    Optional<Setting> findByKey(String key);

    Setting save(Setting setting);
}
