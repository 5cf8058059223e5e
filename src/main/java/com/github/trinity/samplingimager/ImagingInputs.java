package com.github.trinity.samplingimager;

/**
 * Read-only inputs of one imaging run, already parsed by the ingestion layer.
 *
 * @author Sean Phillips
 */
public final class ImagingInputs {

    private final ReceiverSet receivers;
    private final TimeAxis timeAxis;
    private final DataVolume data;
    private final ImpulseResponseVolume impulseResponses;
    private final SearchGrid grid;

    public ImagingInputs(ReceiverSet receivers, TimeAxis timeAxis, DataVolume data,
                         ImpulseResponseVolume impulseResponses, SearchGrid grid) {
        this.receivers = receivers;
        this.timeAxis = timeAxis;
        this.data = data;
        this.impulseResponses = impulseResponses;
        this.grid = grid;
    }

    public ReceiverSet getReceivers() {
        return receivers;
    }

    public TimeAxis getTimeAxis() {
        return timeAxis;
    }

    public DataVolume getData() {
        return data;
    }

    public ImpulseResponseVolume getImpulseResponses() {
        return impulseResponses;
    }

    public SearchGrid getGrid() {
        return grid;
    }

    /**
     * Checks every extent against the receivers, the time axis and the grid.
     *
     * @throws DimensionMismatchException on the first inconsistency
     */
    public void validate() {
        SignalOperator extents = new SignalOperator(receivers, timeAxis);
        extents.checkExtents(data);
        extents.checkExtents(impulseResponses, grid);
    }
}
