/**
 * Mode orchestration for paragraph labeling.
 *
 * @see com.structura.labeling.service.orchestration.LabelingOrchestrator
 */
package com.structura.labeling.service.orchestration;
