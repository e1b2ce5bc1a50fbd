package org.jstats.pitchlens_api.modules.dataset.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import org.jspecify.annotations.Nullable;
import org.jstats.pitchlens_api.core.error.ConfigurationException;
import org.jstats.pitchlens_api.modules.dataset.model.EventDataset;
import org.jstats.pitchlens_api.modules.dataset.model.TrackingDataset;
import org.jstats.pitchlens_api.modules.geometry.model.CoordinateSystem;
import org.jstats.pitchlens_api.modules.geometry.model.PitchDimensions;
import org.jstats.pitchlens_api.modules.geometry.registry.CoordinateSystemRegistry;
import org.jstats.pitchlens_api.modules.orientation.model.Orientation;
import org.jstats.pitchlens_api.modules.state.StateAnnotator;
import org.jstats.pitchlens_api.modules.transform.model.TransformRequest;
import org.jstats.pitchlens_api.modules.transform.service.DatasetTransformer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Stateless HTTP access to the transform and state operations: the dataset travels in the request body
 * and the derived dataset comes back in the response.
 */
@Tag(name = "Datasets", description = "Re-express datasets in other coordinate systems and attach match state")
@Validated
@RestController
@RequestMapping("/api/datasets")
public class DatasetController {

    private static final Logger log = LoggerFactory.getLogger(DatasetController.class);

    private final CoordinateSystemRegistry registry;
    private final DatasetTransformer transformer;
    private final StateAnnotator stateAnnotator;

    public DatasetController(CoordinateSystemRegistry registry,
                             DatasetTransformer transformer,
                             StateAnnotator stateAnnotator) {
        this.registry = registry;
        this.transformer = transformer;
        this.stateAnnotator = stateAnnotator;
    }

    /**
     * Example:
     * POST /api/datasets/events/transform?coordinates=opta&orientation=HOME_TEAM
     */
    @Operation(
            summary = "Transform an event dataset",
            description = "Maps every event to the target coordinate system, orientation or pitch dimensions. "
                    + "Give either a provider id or all four pitch bounds, not both.",
            responses = {
                    @ApiResponse(responseCode = "200", description = "Transformed dataset",
                            content = @Content(mediaType = "application/json",
                                    schema = @Schema(implementation = EventDataset.class))),
                    @ApiResponse(responseCode = "400", description = "Invalid or contradicting target",
                            content = @Content(mediaType = "application/problem+json")),
                    @ApiResponse(responseCode = "422", description = "An event lacks the context the orientation needs",
                            content = @Content(mediaType = "application/problem+json"))
            }
    )
    @PostMapping("/events/transform")
    public EventDataset transformEvents(
            @RequestBody EventDataset dataset,
            @RequestParam(required = false) @Nullable String coordinates,
            @RequestParam(required = false) @Nullable Orientation orientation,
            @RequestParam(required = false) @Positive @Nullable Double pitchLength,
            @RequestParam(required = false) @Positive @Nullable Double pitchWidth,
            @RequestParam(required = false) @Nullable Double xMin,
            @RequestParam(required = false) @Nullable Double xMax,
            @RequestParam(required = false) @Nullable Double yMin,
            @RequestParam(required = false) @Nullable Double yMax) {

        var request = toRequest(coordinates, orientation, pitchLength, pitchWidth, xMin, xMax, yMin, yMax);
        return transformer.transform(dataset, request);
    }

    @Operation(
            summary = "Transform a tracking dataset",
            description = "Same targets as the event transform; ball and player positions of every frame are mapped.",
            responses = {
                    @ApiResponse(responseCode = "200", description = "Transformed dataset",
                            content = @Content(mediaType = "application/json",
                                    schema = @Schema(implementation = TrackingDataset.class))),
                    @ApiResponse(responseCode = "400", description = "Invalid or contradicting target",
                            content = @Content(mediaType = "application/problem+json")),
                    @ApiResponse(responseCode = "422", description = "A frame lacks the context the orientation needs",
                            content = @Content(mediaType = "application/problem+json"))
            }
    )
    @PostMapping("/tracking/transform")
    public TrackingDataset transformTracking(
            @RequestBody TrackingDataset dataset,
            @RequestParam(required = false) @Nullable String coordinates,
            @RequestParam(required = false) @Nullable Orientation orientation,
            @RequestParam(required = false) @Positive @Nullable Double pitchLength,
            @RequestParam(required = false) @Positive @Nullable Double pitchWidth,
            @RequestParam(required = false) @Nullable Double xMin,
            @RequestParam(required = false) @Nullable Double xMax,
            @RequestParam(required = false) @Nullable Double yMin,
            @RequestParam(required = false) @Nullable Double yMax) {

        var request = toRequest(coordinates, orientation, pitchLength, pitchWidth, xMin, xMax, yMin, yMax);
        return transformer.transform(dataset, request);
    }

    /**
     * Example:
     * POST /api/datasets/events/state?builders=score,lineup
     */
    @Operation(
            summary = "Attach match state to every event",
            description = "Runs the named state builders in one ordered pass over the events.",
            responses = {
                    @ApiResponse(responseCode = "200", description = "Annotated dataset",
                            content = @Content(mediaType = "application/json",
                                    schema = @Schema(implementation = EventDataset.class))),
                    @ApiResponse(responseCode = "400", description = "Unknown or repeated builder",
                            content = @Content(mediaType = "application/problem+json"))
            }
    )
    @PostMapping("/events/state")
    public EventDataset addState(
            @RequestBody EventDataset dataset,
            @Parameter(description = "Builder keys, e.g. score,sequence,lineup,formation")
            @RequestParam("builders") @NotEmpty List<String> builders) {

        return stateAnnotator.addState(dataset, builders.toArray(String[]::new));
    }

    @Operation(summary = "List known coordinate systems")
    @GetMapping("/coordinate-systems")
    public List<String> coordinateSystems() {
        return registry.providers();
    }

    @Operation(
            summary = "Describe a provider's coordinate system",
            responses = {
                    @ApiResponse(responseCode = "200", description = "OK"),
                    @ApiResponse(responseCode = "400", description = "Unknown provider",
                            content = @Content(mediaType = "application/problem+json"))
            }
    )
    @GetMapping("/coordinate-systems/{provider}")
    public CoordinateSystem coordinateSystem(
            @PathVariable String provider,
            @RequestParam(required = false) @Positive @Nullable Double pitchLength,
            @RequestParam(required = false) @Positive @Nullable Double pitchWidth) {
        return registry.forProvider(provider, pitchLength, pitchWidth);
    }

    private TransformRequest toRequest(@Nullable String coordinates,
                                       @Nullable Orientation orientation,
                                       @Nullable Double pitchLength,
                                       @Nullable Double pitchWidth,
                                       @Nullable Double xMin,
                                       @Nullable Double xMax,
                                       @Nullable Double yMin,
                                       @Nullable Double yMax) {
        var bounds = Stream.of(xMin, xMax, yMin, yMax).filter(Objects::nonNull).count();
        if (bounds != 0 && bounds != 4) {
            throw new ConfigurationException("Pitch dimensions need all of xMin, xMax, yMin and yMax");
        }

        CoordinateSystem toSystem = coordinates != null
                ? registry.forProvider(coordinates, pitchLength, pitchWidth)
                : null;
        PitchDimensions toDimensions = bounds == 4
                ? PitchDimensions.of(xMin, xMax, yMin, yMax)
                : null;

        var request = new TransformRequest(toSystem, orientation, toDimensions);
        if (log.isDebugEnabled()) {
            log.debug("Transform request {}", request);
        }
        return request;
    }
}
