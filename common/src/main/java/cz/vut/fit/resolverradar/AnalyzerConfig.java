package cz.vut.fit.resolverradar;

/**
 * The configuration keys, descriptions and default values for the resolver analyzer.
 */
@SuppressWarnings("ALL")
public class AnalyzerConfig {
    /* --- DNS probes --- */
    public static final String DNS_TIMEOUT_MS_CONFIG = "analyzer.dns.timeout";
    public static final String DNS_TIMEOUT_MS_DOC = "The time to wait for a response to a single probe query (milliseconds).";
    public static final String DNS_TIMEOUT_MS_DEFAULT = "5000";

    public static final String DNSSEC_UDP_PAYLOAD_CONFIG = "analyzer.dns.dnssec.udp.payload";
    public static final String DNSSEC_UDP_PAYLOAD_DOC = "The EDNS0 UDP payload size advertised in the DNSSEC probe (bytes).";
    public static final String DNSSEC_UDP_PAYLOAD_DEFAULT = "1232";

    public static final String RECURSION_DOMAIN_CONFIG = "analyzer.domain.recursion";
    public static final String RECURSION_DOMAIN_DOC = "The domain name queried by the recursion probe.";
    public static final String RECURSION_DOMAIN_DEFAULT = "google.com";

    public static final String LATENCY_DOMAIN_CONFIG = "analyzer.domain.latency";
    public static final String LATENCY_DOMAIN_DOC = "The domain name queried by the latency probe.";
    public static final String LATENCY_DOMAIN_DEFAULT = "google.com";

    public static final String DNSSEC_DOMAIN_CONFIG = "analyzer.domain.dnssec";
    public static final String DNSSEC_DOMAIN_DOC = "A domain name with a valid DNSSEC signature chain, queried by the DNSSEC probe.";
    public static final String DNSSEC_DOMAIN_DEFAULT = "iifon.org";

    public static final String MALICIOUS_DOMAIN_CONFIG = "analyzer.domain.malicious";
    public static final String MALICIOUS_DOMAIN_DOC = "A known-malicious domain name, queried by the malicious-domain probe.";
    public static final String MALICIOUS_DOMAIN_DEFAULT = "008k.com";

    public static final String CACHE_TTL_DOMAIN_CONFIG = "analyzer.domain.cache.ttl";
    public static final String CACHE_TTL_DOMAIN_DOC = "The domain name sampled by the cache TTL probe.";
    public static final String CACHE_TTL_DOMAIN_DEFAULT = "isc.org";

    /* --- Cache TTL probe --- */
    public static final String CACHE_TTL_INITIAL_PROBES_CONFIG = "analyzer.cache.ttl.initial.probes";
    public static final String CACHE_TTL_INITIAL_PROBES_DOC = "The number of probes sent in the first cache TTL sampling phase.";
    public static final String CACHE_TTL_INITIAL_PROBES_DEFAULT = "4";

    public static final String CACHE_TTL_FINE_PROBES_CONFIG = "analyzer.cache.ttl.fine.probes";
    public static final String CACHE_TTL_FINE_PROBES_DOC = "The number of probes sent in the second phase when the cached entry is about to expire.";
    public static final String CACHE_TTL_FINE_PROBES_DEFAULT = "15";

    public static final String CACHE_TTL_INTERVAL_MS_CONFIG = "analyzer.cache.ttl.interval";
    public static final String CACHE_TTL_INTERVAL_MS_DOC = "The pause between two cache TTL probes (milliseconds).";
    public static final String CACHE_TTL_INTERVAL_MS_DEFAULT = "1000";

    public static final String CACHE_TTL_THRESHOLD_CONFIG = "analyzer.cache.ttl.threshold";
    public static final String CACHE_TTL_THRESHOLD_DOC = "The highest residual TTL (seconds) after the first phase that triggers the second phase.";
    public static final String CACHE_TTL_THRESHOLD_DEFAULT = "3";

    /* --- Traceroute --- */
    public static final String TRACEROUTE_ENABLED_CONFIG = "analyzer.traceroute.enabled";
    public static final String TRACEROUTE_ENABLED_DOC = "If true, a traceroute towards each resolver is recorded.";
    public static final String TRACEROUTE_ENABLED_DEFAULT = "true";

    public static final String TRACEROUTE_MAX_HOPS_CONFIG = "analyzer.traceroute.max.hops";
    public static final String TRACEROUTE_MAX_HOPS_DOC = "The maximum number of hops probed by the traceroute utility.";
    public static final String TRACEROUTE_MAX_HOPS_DEFAULT = "30";

    public static final String TRACEROUTE_HOP_TIMEOUT_S_CONFIG = "analyzer.traceroute.hop.timeout";
    public static final String TRACEROUTE_HOP_TIMEOUT_S_DOC = "The time the traceroute utility waits for a reply to a single hop probe (seconds).";
    public static final String TRACEROUTE_HOP_TIMEOUT_S_DEFAULT = "3";

    public static final String TRACEROUTE_TIMEOUT_S_CONFIG = "analyzer.traceroute.timeout";
    public static final String TRACEROUTE_TIMEOUT_S_DOC = "The time after which a running traceroute is killed (seconds).";
    public static final String TRACEROUTE_TIMEOUT_S_DEFAULT = "120";

    /* --- Cycle --- */
    public static final String RESOLVER_DELAY_MS_CONFIG = "analyzer.resolver.delay";
    public static final String RESOLVER_DELAY_MS_DOC = "The pause between the analyses of two resolvers (milliseconds).";
    public static final String RESOLVER_DELAY_MS_DEFAULT = "100";

    public static final String PROGRESS_INTERVAL_CONFIG = "analyzer.progress.interval";
    public static final String PROGRESS_INTERVAL_DOC = "Progress is reported after every N analyzed resolvers (and after the last one).";
    public static final String PROGRESS_INTERVAL_DEFAULT = "10";

    public static final String EXCLUDED_ADDRESSES_CONFIG = "analyzer.excluded.addresses";
    public static final String EXCLUDED_ADDRESSES_DOC = "Resolver addresses that are never probed (comma-separated).";
    public static final String EXCLUDED_ADDRESSES_DEFAULT = "";

    public static final String DISCOVERY_ENABLED_CONFIG = "analyzer.discovery.enabled";
    public static final String DISCOVERY_ENABLED_DOC = "If true, the system-configured resolvers and DHCP servers of this host are detected and added to the run.";
    public static final String DISCOVERY_ENABLED_DEFAULT = "true";

    public static final String TIMESTAMPS_UTC_CONFIG = "analyzer.timestamps.utc";
    public static final String TIMESTAMPS_UTC_DOC = "If true, timestamps are recorded in UTC. Otherwise, the system time zone is used.";
    public static final String TIMESTAMPS_UTC_DEFAULT = "true";

    /* --- Storage --- */
    public static final String STORAGE_TYPE_CONFIG = "analyzer.storage.type";
    public static final String STORAGE_TYPE_DOC = "The result storage to use. One of postgres / jsonl.";
    public static final String STORAGE_TYPE_DEFAULT = "postgres";

    public static final String JSONL_PATH_CONFIG = "analyzer.storage.jsonl.path";
    public static final String JSONL_PATH_DOC = "The file the jsonl storage appends the results to.";
    public static final String JSONL_PATH_DEFAULT = "results.jsonl";

    public static final String DB_URL_CONFIG = "analyzer.db.url";
    public static final String DB_URL_DOC = "The JDBC URL of the PostgreSQL database.";
    public static final String DB_URL_DEFAULT = "jdbc:postgresql://localhost:5432/dns_analyzer";

    public static final String DB_USER_CONFIG = "analyzer.db.user";
    public static final String DB_USER_DOC = "The PostgreSQL user name.";
    public static final String DB_USER_DEFAULT = "postgres";

    public static final String DB_PASSWORD_CONFIG = "analyzer.db.password";
    public static final String DB_PASSWORD_DOC = "The PostgreSQL password.";
    public static final String DB_PASSWORD_DEFAULT = "";

    /* --- WHOIS --- */
    public static final String WHOIS_RDAP_URL_CONFIG = "analyzer.whois.rdap.url";
    public static final String WHOIS_RDAP_URL_DOC = "The RDAP bootstrap endpoint for IP lookups; the address is appended.";
    public static final String WHOIS_RDAP_URL_DEFAULT = "https://rdap.org/ip/";

    public static final String WHOIS_TIMEOUT_S_CONFIG = "analyzer.whois.timeout";
    public static final String WHOIS_TIMEOUT_S_DOC = "The request timeout to use for RDAP lookups (seconds).";
    public static final String WHOIS_TIMEOUT_S_DEFAULT = "10";

    public static final String WHOIS_RATE_CONFIG = "analyzer.whois.rate";
    public static final String WHOIS_RATE_DOC = "The maximum number of live RDAP lookups per second.";
    public static final String WHOIS_RATE_DEFAULT = "1.0";

    public static final String WHOIS_MAX_LOOKUPS_CONFIG = "analyzer.whois.max.lookups.per.cycle";
    public static final String WHOIS_MAX_LOOKUPS_DOC = "The maximum number of live RDAP lookups in one cycle. Zero disables live lookups.";
    public static final String WHOIS_MAX_LOOKUPS_DEFAULT = "50";

    /* --- Measuring host --- */
    public static final String PUBLIC_IP_SERVICES_CONFIG = "analyzer.host.public.ip.services";
    public static final String PUBLIC_IP_SERVICES_DOC = "HTTP services echoing the caller's public address, tried in order (comma-separated).";
    public static final String PUBLIC_IP_SERVICES_DEFAULT = "https://api.ipify.org?format=text,https://ifconfig.me/ip";

    public static final String PUBLIC_IP_TIMEOUT_S_CONFIG = "analyzer.host.public.ip.timeout";
    public static final String PUBLIC_IP_TIMEOUT_S_DOC = "The request timeout to use for the public address lookup (seconds).";
    public static final String PUBLIC_IP_TIMEOUT_S_DEFAULT = "5";
}
