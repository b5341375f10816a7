package com.inboundlogger.domain.config.model.valobj;

import com.google.common.hash.Hashing;
import com.inboundlogger.types.common.Constants;
import com.inboundlogger.types.enums.StorageAdapterKind;
import com.inboundlogger.types.exception.ConfigurationException;
import lombok.Value;
import org.apache.commons.lang3.StringUtils;

import java.nio.charset.StandardCharsets;

/**
 * 辅助 sink 的连接位置与适配器类型。
 */
@Value
public class SecondarySinkSettings {

    String location;
    StorageAdapterKind adapterKind;

    public static SecondarySinkSettings of(String location, StorageAdapterKind adapterKind) {
        if (StringUtils.isBlank(location)) {
            throw new ConfigurationException("Secondary sink location must not be blank");
        }
        if (adapterKind == null) {
            throw new ConfigurationException("Secondary sink adapter kind must not be null");
        }
        return new SecondarySinkSettings(location.trim(), adapterKind);
    }

    /**
     * 已解析适配器在缓存中的 key。
     */
    public String cacheKey() {
        return "secondary-sink:" + adapterKind.getValue() + ":" + location;
    }

    /**
     * 命名连接的名称。每个适配器类型加位置各占一个名称，切换位置不会改写其他位置已缓存适配器的连接池。
     */
    public String connectionName() {
        return Constants.SECONDARY_CONNECTION_NAME + "_"
                + Hashing.sha256().hashString(cacheKey(), StandardCharsets.UTF_8).toString().substring(0, 16);
    }
}
