package fun.fengwk.rp.core.service.readme.model;

import lombok.Builder;
import lombok.Data;

/**
 * @author fengwk
 */
@Data
@Builder
public class CategoryDetails {

    private String url;
    private String categoryName;

}
