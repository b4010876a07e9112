package sjtu.sdic.ehr.common;

import cn.hutool.core.util.StrUtil;
import cn.hutool.setting.dialect.Props;

/**
 * Created by Cachhe on 2019/5/2.
 */
public class ConfigUtils {

    /**
     * load a config bean from application.properties
     *
     * @param tClass bean class
     * @param prefix key prefix, without the trailing dot
     * @return bean filled from the matching keys
     */
    public static <T> T loadConfig(Class<T> tClass, String prefix) {
        return loadConfig(tClass, prefix, "");
    }

    /**
     * load a config bean from application-{environment}.properties, or
     * application.properties when environment is blank
     */
    public static <T> T loadConfig(Class<T> tClass, String prefix, String environment) {
        StringBuilder configFileBuilder = new StringBuilder("application");
        if (StrUtil.isNotBlank(environment)) {
            configFileBuilder.append("-").append(environment);
        }
        configFileBuilder.append(".properties");
        Props props = new Props(configFileBuilder.toString());
        return props.toBean(tClass, prefix);
    }
}
