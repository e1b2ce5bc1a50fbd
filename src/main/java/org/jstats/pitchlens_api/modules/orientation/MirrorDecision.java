package org.jstats.pitchlens_api.modules.orientation;

/**
 * How one record has to be reflected.
 *
 * @param flip         reverse the attacking direction: reflect x and y about the centre of the source pitch
 * @param verticalFlip reverse the y-axis convention: reflect y about the centre of the target pitch
 */
public record MirrorDecision(boolean flip, boolean verticalFlip) {

    public boolean any() {
        return flip || verticalFlip;
    }
}
