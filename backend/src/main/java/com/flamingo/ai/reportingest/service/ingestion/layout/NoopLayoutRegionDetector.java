package com.flamingo.ai.reportingest.service.ingestion.layout;

import com.flamingo.ai.reportingest.service.ingestion.model.LayoutBlock;
import com.flamingo.ai.reportingest.service.ingestion.model.PageRecord;
import java.util.List;
import org.springframework.stereotype.Component;

/** Default detector; a layout model bean marked {@code @Primary} replaces it. */
@Component
public class NoopLayoutRegionDetector implements LayoutRegionDetector {

  @Override
  public List<LayoutBlock> detect(PageRecord page) {
    return List.of();
  }
}
