package fun.fengwk.rp.core.service.readme.model;

import lombok.Builder;
import lombok.Data;

/**
 * @author fengwk
 */
@Data
@Builder
public class ComponentPaths {

    private String url;
    private String filePath;

}
