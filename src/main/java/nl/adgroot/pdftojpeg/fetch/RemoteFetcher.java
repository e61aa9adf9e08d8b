package nl.adgroot.pdftojpeg.fetch;

/**
 * Downloads the bytes behind a URL.
 */
public interface RemoteFetcher {

  byte[] fetch(String url) throws FetchException;
}
